package com.tally.service.core.support;

/** A duplicate key or a reference to an unknown subject/scope. The transaction was aborted. */
public class IntegrityViolationException extends TallyException {

    public IntegrityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
