package com.tally.service.core.support;

/**
 * The store aborted a transaction for a reason that may clear up on its own (lock contention,
 * timeout, lost connection). Nothing was committed; callers recover at the next natural attempt.
 */
public class TransientStoreException extends TallyException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
