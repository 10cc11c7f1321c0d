package com.tally.service.core.retention;

import java.time.Instant;

public record StoredHistoryEntry(
        long id, long subjectId, HistoryLogType logType, byte[] value, String contentType, Instant recordedAt) {}
