package com.tally.service.core.scheduler;

import com.tally.service.core.support.ConfigurationException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.chrono.Chronology;
import java.time.chrono.IsoChronology;
import java.util.TimeZone;

/**
 * The one timezone shape the scheduler computes with, whatever the caller registered the schedule
 * with.
 */
public record CanonicalZone(ZoneId zone, Chronology chronology) {

    public static final CanonicalZone UTC = new CanonicalZone(ZoneOffset.UTC, IsoChronology.INSTANCE);

    public CanonicalZone {
        if (zone == null) {
            throw new ConfigurationException("zone is required");
        }
        zone = zone.normalized();
        if (chronology == null) {
            chronology = IsoChronology.INSTANCE;
        }
    }

    /**
     * Accepts null (UTC), a zone or offset id string, {@link ZoneId}, {@link TimeZone},
     * {@link ZonedDateTime}, {@link OffsetDateTime} or {@link Clock}.
     */
    public static CanonicalZone of(Object timezone) {
        if (timezone == null) {
            return UTC;
        }
        if (timezone instanceof CanonicalZone canonical) {
            return canonical;
        }
        if (timezone instanceof ZoneId zoneId) {
            return iso(zoneId);
        }
        if (timezone instanceof TimeZone tz) {
            return iso(tz.toZoneId());
        }
        if (timezone instanceof ZonedDateTime zdt) {
            return iso(zdt.getZone());
        }
        if (timezone instanceof OffsetDateTime odt) {
            return iso(odt.getOffset());
        }
        if (timezone instanceof Clock clock) {
            return iso(clock.getZone());
        }
        if (timezone instanceof CharSequence text) {
            String id = text.toString().trim();
            if (id.isEmpty()) {
                return UTC;
            }
            try {
                return iso(ZoneId.of(id, ZoneId.SHORT_IDS));
            } catch (DateTimeException ex) {
                throw new ConfigurationException("Unknown timezone '" + id + "'", ex);
            }
        }
        throw new ConfigurationException(
                "Unsupported timezone representation: " + timezone.getClass().getName());
    }

    private static CanonicalZone iso(ZoneId zoneId) {
        return new CanonicalZone(zoneId, IsoChronology.INSTANCE);
    }

    @Override
    public String toString() {
        return zone.getId();
    }
}
