package com.tally.service.core.scheduler;

import com.tally.service.core.support.ConfigurationException;
import java.time.Instant;
import java.time.ZonedDateTime;
import org.springframework.scheduling.support.CronExpression;

/**
 * A parsed five-field cron expression (minute hour day-of-month month day-of-week) or an
 * {@code @monthly} style macro, bound to the zone its fields are read in.
 */
public final class CronSpec {

    private final String expression;
    private final CronExpression cron;
    private final CanonicalZone zone;

    private CronSpec(String expression, CronExpression cron, CanonicalZone zone) {
        this.expression = expression;
        this.cron = cron;
        this.zone = zone;
    }

    public static CronSpec parse(String expression, CanonicalZone zone) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Cron expression is required");
        }
        String trimmed = expression.trim();
        String springExpression;
        if (trimmed.startsWith("@")) {
            springExpression = trimmed;
        } else {
            int fields = trimmed.split("\\s+").length;
            if (fields != 5) {
                throw new ConfigurationException(
                        "Cron expression '" + trimmed + "' must have 5 fields, found " + fields);
            }
            // Spring expects a leading seconds field
            springExpression = "0 " + trimmed;
        }
        try {
            return new CronSpec(trimmed, CronExpression.parse(springExpression), zone != null ? zone : CanonicalZone.UTC);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Malformed cron expression '" + trimmed + "': " + ex.getMessage(), ex);
        }
    }

    /** First occurrence strictly after {@code instant}. */
    public Instant nextAfter(Instant instant) {
        ZonedDateTime next = cron.next(instant.atZone(zone.zone()));
        if (next == null) {
            throw new ConfigurationException("Cron expression '" + expression + "' has no occurrence after " + instant);
        }
        return next.toInstant();
    }

    public String expression() {
        return expression;
    }

    public CanonicalZone zone() {
        return zone;
    }

    @Override
    public String toString() {
        return expression + " (" + zone + ")";
    }
}
