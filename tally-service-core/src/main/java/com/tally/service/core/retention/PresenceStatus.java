package com.tally.service.core.retention;

import com.tally.service.core.support.ConfigurationException;
import java.util.Locale;

public enum PresenceStatus {
    ONLINE,
    IDLE,
    DND,
    OFFLINE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PresenceStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OFFLINE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported presence status: " + value, ex);
        }
    }
}
