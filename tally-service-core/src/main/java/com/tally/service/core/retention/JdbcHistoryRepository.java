package com.tally.service.core.retention;

import com.tally.service.core.support.StoreLocks;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcHistoryRepository implements HistoryRepository {

    private static final String LOCK_SQL = "select count(*) from (select pg_advisory_xact_lock(:lock_key)) l";

    private static final String SELECT_COLUMNS =
            "select id, subject_id, log_type, item_value, content_type, recorded_at from tally.history_entries";

    private static final String INSERT_SQL =
            """
            insert into tally.history_entries (subject_id, log_type, item_value, content_type, recorded_at)
            values (:subject_id, :log_type, :item_value, :content_type, :recorded_at)
            returning id
            """;

    private static final String TRIM_SQL_TEMPLATE =
            """
            delete from tally.history_entries
            where subject_id = :subject_id
              and log_type = :log_type
              and id not in (
                select id from tally.history_entries
                where subject_id = :subject_id and log_type = :log_type
                order by %s
                limit :cap)
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public void lockLog(long subjectId, HistoryLogType logType) {
        jdbc.queryForObject(
                LOCK_SQL,
                new MapSqlParameterSource("lock_key", StoreLocks.retentionKey(subjectId, logType)),
                Long.class);
    }

    @Override
    public Optional<StoredHistoryEntry> findLatest(long subjectId, HistoryLogType logType, TieBreakPolicy tieBreak) {
        List<StoredHistoryEntry> rows = jdbc.query(
                SELECT_COLUMNS + " where subject_id = :subject_id and log_type = :log_type order by "
                        + tieBreak.orderBy() + " limit 1",
                logParams(subjectId, logType),
                JdbcHistoryRepository::mapRow);
        return rows.stream().findFirst();
    }

    @Override
    public long insert(long subjectId, HistoryEntry entry) {
        MapSqlParameterSource params = logParams(subjectId, entry.logType())
                .addValue("item_value", entry.value())
                .addValue("content_type", entry.contentType())
                .addValue("recorded_at", Timestamp.from(entry.recordedAt()));
        Long id = jdbc.queryForObject(INSERT_SQL, params, Long.class);
        return id != null ? id : -1L;
    }

    @Override
    public int trim(long subjectId, HistoryLogType logType, int cap, TieBreakPolicy tieBreak) {
        MapSqlParameterSource params = logParams(subjectId, logType).addValue("cap", cap);
        return jdbc.update(TRIM_SQL_TEMPLATE.formatted(tieBreak.orderBy()), params);
    }

    @Override
    public List<StoredHistoryEntry> list(long subjectId, HistoryLogType logType, TieBreakPolicy tieBreak) {
        return jdbc.query(
                SELECT_COLUMNS + " where subject_id = :subject_id and log_type = :log_type order by "
                        + tieBreak.orderBy(),
                logParams(subjectId, logType),
                JdbcHistoryRepository::mapRow);
    }

    private static MapSqlParameterSource logParams(long subjectId, HistoryLogType logType) {
        return new MapSqlParameterSource().addValue("subject_id", subjectId).addValue("log_type", logType.name());
    }

    private static StoredHistoryEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new StoredHistoryEntry(
                rs.getLong("id"),
                rs.getLong("subject_id"),
                HistoryLogType.valueOf(rs.getString("log_type")),
                rs.getBytes("item_value"),
                rs.getString("content_type"),
                rs.getTimestamp("recorded_at").toInstant());
    }
}
