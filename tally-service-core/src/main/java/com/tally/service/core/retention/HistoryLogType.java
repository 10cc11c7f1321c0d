package com.tally.service.core.retention;

import com.tally.service.core.support.ConfigurationException;
import java.util.Locale;

/** Bounded per-subject logs. Caps here are defaults; {@code tally.retention.caps} overrides them. */
public enum HistoryLogType {
    PRESENCE(2, false),
    AVATAR(12, true),
    NAME(24, true);

    private final int defaultCap;
    private final boolean deduplicated;

    HistoryLogType(int defaultCap, boolean deduplicated) {
        this.defaultCap = defaultCap;
        this.deduplicated = deduplicated;
    }

    public int defaultCap() {
        return defaultCap;
    }

    /** Whether an insert identical to the latest stored value is skipped. */
    public boolean deduplicated() {
        return deduplicated;
    }

    public static HistoryLogType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("History log type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported history log type: " + value, ex);
        }
    }
}
