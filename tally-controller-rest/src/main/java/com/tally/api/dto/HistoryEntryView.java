package com.tally.api.dto;

import com.tally.service.core.retention.StoredHistoryEntry;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/** Text entries are returned as-is, binary ones base64 encoded. */
public record HistoryEntryView(
        long id, String logType, String contentType, String encoding, String value, Instant recordedAt) {

    public static HistoryEntryView from(StoredHistoryEntry entry) {
        boolean text = entry.contentType() != null && entry.contentType().startsWith("text/");
        return new HistoryEntryView(
                entry.id(),
                entry.logType().name(),
                entry.contentType(),
                text ? "utf-8" : "base64",
                text
                        ? new String(entry.value(), StandardCharsets.UTF_8)
                        : Base64.getEncoder().encodeToString(entry.value()),
                entry.recordedAt());
    }
}
