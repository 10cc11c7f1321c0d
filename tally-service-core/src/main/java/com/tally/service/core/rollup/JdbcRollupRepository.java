package com.tally.service.core.rollup;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.counter.CounterType;
import com.tally.service.core.support.StoreLocks;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcRollupRepository implements RollupRepository {

    private static final String GUARD_SQL = "select count(*) from (select pg_advisory_xact_lock(:lock_key)) g";

    // Bucket start in the shifted frame: truncate the unshifted instant in UTC, then shift back.
    private static final String FRAME_BUCKET =
            "(date_trunc('%s', (%s - cast(:offset_seconds as double precision) * interval '1 second') at time zone 'UTC')"
                    + " at time zone 'UTC') + cast(:offset_seconds as double precision) * interval '1 second'";

    // The delete and the sum are one statement: exactly the deleted mass is promoted.
    private static final String DRAIN_SQL_TEMPLATE =
            """
            with drained as (
                delete from tally.%1$s
                where %2$s < :before
                returning subject_id, scope_id, counter_type, %2$s, counter_value
            ), bucketed as (
                select subject_id, scope_id, counter_type, counter_value, %3$s as bucket
                from drained
            )
            select subject_id, scope_id, counter_type, bucket, sum(counter_value) as total, count(*) as source_rows
            from bucketed
            group by subject_id, scope_id, counter_type, bucket
            order by subject_id, scope_id, counter_type, bucket
            """;

    private static final String DRAIN_FINE_SQL = DRAIN_SQL_TEMPLATE.formatted(
            "fine_counters", "day_bucket", FRAME_BUCKET.formatted("month", "day_bucket"));

    private static final String DRAIN_MEDIUM_SQL = DRAIN_SQL_TEMPLATE.formatted(
            "medium_counters", "month_bucket", FRAME_BUCKET.formatted("year", "month_bucket"));

    private static final String ADD_MEDIUM_SQL =
            """
            insert into tally.medium_counters (subject_id, scope_id, counter_type, month_bucket, counter_value)
            values (:subject_id, :scope_id, :counter_type, :bucket, :delta)
            on conflict (subject_id, scope_id, counter_type, month_bucket)
            do update set counter_value = tally.medium_counters.counter_value + excluded.counter_value
            """;

    private static final String ADD_TOTAL_SQL =
            """
            insert into tally.total_counters
              (subject_id, scope_id, counter_type, counter_value, last_window_start, last_window_count, updated_at)
            values
              (:subject_id, :scope_id, :counter_type, :delta, :bucket, :delta, now())
            on conflict (subject_id, scope_id, counter_type)
            do update set
              counter_value = tally.total_counters.counter_value + excluded.counter_value,
              last_window_count = case
                when tally.total_counters.last_window_start = excluded.last_window_start
                then tally.total_counters.last_window_count + excluded.last_window_count
                when tally.total_counters.last_window_start is null
                  or tally.total_counters.last_window_start < excluded.last_window_start
                then excluded.last_window_count
                else tally.total_counters.last_window_count
              end,
              last_window_start = greatest(tally.total_counters.last_window_start, excluded.last_window_start),
              updated_at = now()
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final TallyCalendar calendar;

    @Override
    public void acquireRollupGuard() {
        jdbc.queryForObject(
                GUARD_SQL, new MapSqlParameterSource("lock_key", StoreLocks.ROLLUP_GUARD_KEY), Long.class);
    }

    @Override
    public List<TierRow> drainFine(Instant before) {
        return jdbc.query(DRAIN_FINE_SQL, drainParams(before), JdbcRollupRepository::mapRow);
    }

    @Override
    public void addMedium(List<TierRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        jdbc.batchUpdate(ADD_MEDIUM_SQL, batch(rows));
    }

    @Override
    public List<TierRow> drainMedium(Instant before) {
        return jdbc.query(DRAIN_MEDIUM_SQL, drainParams(before), JdbcRollupRepository::mapRow);
    }

    @Override
    public void addTotal(List<TierRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        jdbc.batchUpdate(ADD_TOTAL_SQL, batch(rows));
    }

    private MapSqlParameterSource drainParams(Instant before) {
        return new MapSqlParameterSource()
                .addValue("before", Timestamp.from(before))
                .addValue("offset_seconds", calendar.dayOffset().toSeconds());
    }

    private static SqlParameterSource[] batch(List<TierRow> rows) {
        return rows.stream()
                .map(row -> new MapSqlParameterSource()
                        .addValue("subject_id", row.subjectId())
                        .addValue("scope_id", row.scopeId())
                        .addValue("counter_type", row.type().name())
                        .addValue("bucket", Timestamp.from(row.bucket()))
                        .addValue("delta", row.total()))
                .toArray(SqlParameterSource[]::new);
    }

    private static TierRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new TierRow(
                rs.getLong("subject_id"),
                rs.getLong("scope_id"),
                CounterType.valueOf(rs.getString("counter_type")),
                rs.getTimestamp("bucket").toInstant(),
                rs.getLong("total"),
                rs.getInt("source_rows"));
    }
}
