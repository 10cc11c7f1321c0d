package com.tally.service.core.support;

/** Root of the engine's unchecked exceptions. */
public abstract class TallyException extends RuntimeException {

    protected TallyException(String message) {
        super(message);
    }

    protected TallyException(String message, Throwable cause) {
        super(message, cause);
    }
}
