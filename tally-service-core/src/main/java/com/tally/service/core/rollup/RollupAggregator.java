package com.tally.service.core.rollup;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.calendar.TimeWindow;
import com.tally.service.core.config.TallyProperties;
import com.tally.service.core.support.StoreErrors;
import com.tally.service.core.support.TransientStoreException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Promotes counters one tier up: daily rows of the previous month into a monthly row, or monthly rows
 * of the previous year into the total. Rows of older periods still waiting in the source tier, left
 * by a missed or aborted run, are promoted in the same pass into their own buckets. Sum, upsert and
 * delete commit together or not at all, which makes a repeated run over an already consumed window a
 * no-op.
 */
@Service
@Slf4j
public class RollupAggregator {

    private final RollupRepository repository;
    private final TransactionTemplate txTemplate;
    private final TallyCalendar calendar;
    private final Clock clock;

    public RollupAggregator(
            RollupRepository repository,
            PlatformTransactionManager transactionManager,
            TallyCalendar calendar,
            Clock clock,
            TallyProperties properties) {
        this.repository = repository;
        this.calendar = calendar;
        this.clock = clock;
        this.txTemplate = new TransactionTemplate(transactionManager);
        this.txTemplate.setName("tally-rollup");
        this.txTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.txTemplate.setTimeout(
                (int) Math.max(1, properties.getRollup().getTransactionTimeout().toSeconds()));
    }

    /** Parses the token first; an unknown token never reaches the store. */
    public RollupResult aggregate(String periodToken) {
        RollupPeriod period = RollupPeriod.fromToken(periodToken);
        return aggregate(period, Instant.now(clock));
    }

    public RollupResult aggregate(RollupPeriod period, Instant now) {
        TimeWindow window = period.window(now, calendar);
        RollupResult result;
        try {
            result = txTemplate.execute(status -> promote(period, window));
        } catch (RuntimeException ex) {
            RuntimeException translated = StoreErrors.translate("Rollup '" + period.token() + "' " + window, ex);
            if (translated instanceof TransientStoreException) {
                log.warn("Rollup {} for {} aborted; nothing committed, next occurrence retries", period, window, ex);
            } else {
                log.error("Rollup {} for {} failed; nothing committed", period, window, ex);
            }
            throw translated;
        }
        if (result.isEmpty()) {
            log.info("Rollup {} for {}: nothing left to promote", period, window);
        } else {
            log.info(
                    "Rollup {} for {}: promoted {} keys from {} rows, mass {}",
                    period,
                    window,
                    result.keys(),
                    result.sourceRows(),
                    result.mass());
        }
        return result;
    }

    private RollupResult promote(RollupPeriod period, TimeWindow window) {
        repository.acquireRollupGuard();
        List<TierRow> rows = switch (period) {
            case MONTH -> repository.drainFine(window.end());
            case YEAR -> repository.drainMedium(window.end());
        };
        if (!rows.isEmpty()) {
            switch (period) {
                case MONTH -> repository.addMedium(rows);
                case YEAR -> repository.addTotal(rows);
            }
        }
        long backlog = rows.stream().filter(row -> row.bucket().isBefore(window.start())).count();
        if (backlog > 0) {
            log.warn("Rollup {} for {} also promoted {} rows left over from earlier periods", period, window, backlog);
        }
        return RollupResult.of(period, window, rows);
    }
}
