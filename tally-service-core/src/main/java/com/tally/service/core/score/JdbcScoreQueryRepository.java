package com.tally.service.core.score;

import com.tally.service.core.counter.CounterType;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcScoreQueryRepository implements ScoreQueryRepository {

    private static final String FINE_SQL =
            """
            select day_bucket as bucket, sum(counter_value) as total
            from tally.fine_counters
            where subject_id = :subject_id and scope_id = :scope_id and day_bucket >= :from %s
            group by day_bucket
            order by day_bucket
            """;

    private static final String MEDIUM_SQL =
            """
            select month_bucket as bucket, sum(counter_value) as total
            from tally.medium_counters
            where subject_id = :subject_id and scope_id = :scope_id and month_bucket >= :from %s
            group by month_bucket
            order by month_bucket
            """;

    private static final String TOTAL_SQL =
            """
            select counter_type, counter_value, last_window_start, last_window_count
            from tally.total_counters
            where subject_id = :subject_id and scope_id = :scope_id %s
            order by counter_type
            """;

    private static final String TYPE_CLAUSE = "and counter_type = :counter_type";

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public List<BucketCount> fineByDay(long subjectId, long scopeId, CounterType type, Instant from) {
        return buckets(FINE_SQL, subjectId, scopeId, type, from);
    }

    @Override
    public List<BucketCount> mediumByMonth(long subjectId, long scopeId, CounterType type, Instant from) {
        return buckets(MEDIUM_SQL, subjectId, scopeId, type, from);
    }

    @Override
    public List<TotalSnapshot> totals(long subjectId, long scopeId, CounterType type) {
        MapSqlParameterSource params = params(subjectId, scopeId, type);
        return jdbc.query(TOTAL_SQL.formatted(type != null ? TYPE_CLAUSE : ""), params, (rs, rowNum) -> {
            Timestamp windowStart = rs.getTimestamp("last_window_start");
            return new TotalSnapshot(
                    CounterType.valueOf(rs.getString("counter_type")),
                    rs.getLong("counter_value"),
                    windowStart != null ? windowStart.toInstant() : null,
                    rs.getLong("last_window_count"));
        });
    }

    private List<BucketCount> buckets(String sql, long subjectId, long scopeId, CounterType type, Instant from) {
        MapSqlParameterSource params = params(subjectId, scopeId, type).addValue("from", Timestamp.from(from));
        return jdbc.query(
                sql.formatted(type != null ? TYPE_CLAUSE : ""),
                params,
                (rs, rowNum) -> new BucketCount(rs.getTimestamp("bucket").toInstant(), rs.getLong("total")));
    }

    private static MapSqlParameterSource params(long subjectId, long scopeId, CounterType type) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("subject_id", subjectId)
                .addValue("scope_id", scopeId);
        if (type != null) {
            params.addValue("counter_type", type.name());
        }
        return params;
    }
}
