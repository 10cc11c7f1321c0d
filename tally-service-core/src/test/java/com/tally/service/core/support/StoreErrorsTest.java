package com.tally.service.core.support;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.transaction.TransactionTimedOutException;

class StoreErrorsTest {

    @Test
    void constraintViolationsBecomeIntegrityViolations() {
        RuntimeException translated = StoreErrors.translate("History insert", new DuplicateKeyException("pk"));

        assertThat(translated)
                .isInstanceOf(IntegrityViolationException.class)
                .hasMessageStartingWith("History insert")
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void contentionAndTimeoutsBecomeTransient() {
        assertThat(StoreErrors.translate("Rollup", new CannotAcquireLockException("lock")))
                .isInstanceOf(TransientStoreException.class);
        assertThat(StoreErrors.translate("Rollup", new TransactionTimedOutException("deadline")))
                .isInstanceOf(TransientStoreException.class);
    }

    @Test
    void engineExceptionsAndProgrammingErrorsPassThrough() {
        ConfigurationException config = new ConfigurationException("bad");
        BadSqlGrammarException grammar = new BadSqlGrammarException("q", "select", new SQLException("x"));

        assertThat(StoreErrors.translate("op", config)).isSameAs(config);
        assertThat(StoreErrors.translate("op", grammar)).isSameAs(grammar);
    }
}
