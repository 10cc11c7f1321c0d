package com.tally.service.core.counter;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.support.StoreErrors;
import com.tally.service.core.support.StoreLocks;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcCounterStore implements CounterStore {

    private static final String SHARED_GUARD_SQL = "select count(*) from (select pg_advisory_xact_lock_shared(:lock_key)) g";

    private static final String UPSERT_FINE_SQL =
            """
            insert into tally.fine_counters (subject_id, scope_id, counter_type, day_bucket, counter_value)
            values (:subject_id, :scope_id, :counter_type, :day_bucket, :delta)
            on conflict (subject_id, scope_id, counter_type, day_bucket)
            do update set counter_value = tally.fine_counters.counter_value + excluded.counter_value
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate txTemplate;
    private final TallyCalendar calendar;

    @Override
    public void increment(long subjectId, long scopeId, CounterType type, Instant timestamp, long delta) {
        FineCounterKey key = new FineCounterKey(subjectId, scopeId, type, calendar.dayBucket(timestamp));
        incrementBatch(List.of(new CounterDelta(key, delta)));
    }

    @Override
    public void incrementBatch(List<CounterDelta> deltas) {
        if (deltas == null || deltas.isEmpty()) {
            return;
        }
        // Concurrent batches lock rows in the same order.
        List<CounterDelta> ordered = new ArrayList<>(deltas);
        ordered.sort((a, b) -> FineCounterKey.LOCK_ORDER.compare(a.key(), b.key()));
        SqlParameterSource[] batch = ordered.stream()
                .map(JdbcCounterStore::toParams)
                .toArray(SqlParameterSource[]::new);
        try {
            txTemplate.executeWithoutResult(status -> {
                jdbc.queryForObject(
                        SHARED_GUARD_SQL,
                        new MapSqlParameterSource("lock_key", StoreLocks.ROLLUP_GUARD_KEY),
                        Long.class);
                jdbc.batchUpdate(UPSERT_FINE_SQL, batch);
            });
        } catch (RuntimeException ex) {
            log.error("Failed to apply {} counter deltas", ordered.size(), ex);
            throw StoreErrors.translate("Counter increment", ex);
        }
    }

    private static SqlParameterSource toParams(CounterDelta delta) {
        FineCounterKey key = delta.key();
        return new MapSqlParameterSource()
                .addValue("subject_id", key.subjectId())
                .addValue("scope_id", key.scopeId())
                .addValue("counter_type", key.type().name())
                .addValue("day_bucket", Timestamp.from(key.dayBucket()))
                .addValue("delta", delta.delta());
    }
}
