package com.tally.service.core.rollup;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.calendar.TimeWindow;
import com.tally.service.core.support.ConfigurationException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Which tier-to-tier promotion a rollup runs. {@code YEAR} reads the monthly tier and writes the
 * total tier; there is no yearly tier.
 */
public enum RollupPeriod {
    MONTH("month"),
    YEAR("year");

    private final String token;

    RollupPeriod(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /** The previous completed calendar period relative to {@code now}. */
    public TimeWindow window(Instant now, TallyCalendar calendar) {
        LocalDate current = switch (this) {
            case MONTH -> calendar.firstOfMonth(now);
            case YEAR -> calendar.firstOfYear(now);
        };
        LocalDate previous = this == MONTH ? current.minusMonths(1) : current.minusYears(1);
        return new TimeWindow(calendar.startOf(previous), calendar.startOf(current));
    }

    public static RollupPeriod fromToken(String token) {
        if (token == null || token.isBlank()) {
            throw new ConfigurationException("Rollup period token is required");
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (RollupPeriod period : values()) {
            if (period.token.equals(normalized)) {
                return period;
            }
        }
        throw new ConfigurationException(
                "Invalid aggregation period '" + token + "'; expected \"month\" or \"year\"");
    }
}
