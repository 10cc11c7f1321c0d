package com.tally.service.core.retention;

import java.time.Instant;
import java.util.Objects;

/** An entry about to be appended to a subject's bounded log. */
public record HistoryEntry(HistoryLogType logType, byte[] value, String contentType, Instant recordedAt) {

    public HistoryEntry {
        Objects.requireNonNull(logType, "logType");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(recordedAt, "recordedAt");
    }
}
