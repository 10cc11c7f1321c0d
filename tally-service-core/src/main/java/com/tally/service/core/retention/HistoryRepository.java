package com.tally.service.core.retention;

import java.util.List;
import java.util.Optional;

/** Storage for bounded history logs. All methods are expected to run inside the caller's transaction. */
public interface HistoryRepository {

    /** Serialises writers of one (subject, log type) until the surrounding transaction ends. */
    void lockLog(long subjectId, HistoryLogType logType);

    Optional<StoredHistoryEntry> findLatest(long subjectId, HistoryLogType logType, TieBreakPolicy tieBreak);

    long insert(long subjectId, HistoryEntry entry);

    /** Deletes everything ranked after the first {@code cap} entries; returns the number deleted. */
    int trim(long subjectId, HistoryLogType logType, int cap, TieBreakPolicy tieBreak);

    /** Entries most recent first. */
    List<StoredHistoryEntry> list(long subjectId, HistoryLogType logType, TieBreakPolicy tieBreak);
}
