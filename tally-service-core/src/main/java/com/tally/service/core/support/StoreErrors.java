package com.tally.service.core.support;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/** Maps Spring data-access failures onto the engine's error taxonomy. */
public final class StoreErrors {

    private StoreErrors() {}

    public static RuntimeException translate(String operation, RuntimeException ex) {
        if (ex instanceof TallyException) {
            return ex;
        }
        if (ex instanceof DataIntegrityViolationException) {
            return new IntegrityViolationException(operation + " violated a store constraint", ex);
        }
        if (isTransient(ex)) {
            return new TransientStoreException(operation + " aborted: " + ex.getMessage(), ex);
        }
        return ex;
    }

    static boolean isTransient(RuntimeException ex) {
        return ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException
                || ex instanceof TransactionTimedOutException
                || ex instanceof CannotCreateTransactionException;
    }
}
