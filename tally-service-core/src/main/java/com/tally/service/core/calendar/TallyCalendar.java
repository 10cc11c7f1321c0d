package com.tally.service.core.calendar;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Calendar frame shared by counter buckets, rollup windows and score buckets: UTC shifted by a fixed
 * day offset. With the default offset of eight hours a day runs from 08:00Z to 08:00Z, weeks start on
 * Monday 08:00Z and months on the 1st at 08:00Z.
 */
public final class TallyCalendar {

    public static final Duration DEFAULT_DAY_OFFSET = Duration.ofHours(8);

    private final Duration dayOffset;

    public TallyCalendar(Duration dayOffset) {
        Objects.requireNonNull(dayOffset, "dayOffset");
        if (dayOffset.isNegative() || dayOffset.compareTo(Duration.ofDays(1)) >= 0) {
            throw new IllegalArgumentException("Day offset must be within [0, 24h): " + dayOffset);
        }
        this.dayOffset = dayOffset;
    }

    public static TallyCalendar withDefaultOffset() {
        return new TallyCalendar(DEFAULT_DAY_OFFSET);
    }

    public Duration dayOffset() {
        return dayOffset;
    }

    /** The frame-local date the instant falls on. */
    public LocalDate localDate(Instant instant) {
        return LocalDate.ofInstant(instant.minus(dayOffset), ZoneOffset.UTC);
    }

    /** The instant a frame-local date starts at. */
    public Instant startOf(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().plus(dayOffset);
    }

    public Instant dayBucket(Instant instant) {
        return startOf(localDate(instant));
    }

    public Instant monthBucket(Instant instant) {
        return startOf(firstOfMonth(instant));
    }

    public LocalDate firstOfWeek(Instant instant) {
        return localDate(instant).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public LocalDate firstOfMonth(Instant instant) {
        return localDate(instant).withDayOfMonth(1);
    }

    public LocalDate firstOfYear(Instant instant) {
        return localDate(instant).withDayOfYear(1);
    }

    @Override
    public String toString() {
        return "TallyCalendar[dayOffset=" + dayOffset + "]";
    }
}
