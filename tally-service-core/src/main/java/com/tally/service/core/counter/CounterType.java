package com.tally.service.core.counter;

import com.tally.service.core.support.ConfigurationException;
import java.util.Locale;

/** Kinds of counted events. Codes 1-3 are the legacy numeric identifiers. */
public enum CounterType {
    COUNT(1),
    HUNT(2),
    BATTLE(3),
    MESSAGE(4);

    private final int code;

    CounterType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static CounterType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Counter type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CounterType type : values()) {
            if (type.name().equals(normalized) || String.valueOf(type.code).equals(normalized)) {
                return type;
            }
        }
        throw new ConfigurationException("Unsupported counter type: " + value);
    }

    public static CounterType fromCode(int code) {
        for (CounterType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new ConfigurationException("Unsupported counter type code: " + code);
    }
}
