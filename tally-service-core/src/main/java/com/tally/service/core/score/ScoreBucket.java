package com.tally.service.core.score;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.calendar.TimeWindow;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Named half-open intervals a score is reported for, and which counter tiers each one reads.
 *
 * <p>Day and week buckets read only the daily tier. Month buckets add the monthly tier. Year buckets
 * also add total rows whose most recently promoted window starts at the bucket start. All-time reads
 * every tier.
 */
public enum ScoreBucket {
    TODAY("today", TotalRead.NONE, false),
    YESTERDAY("yesterday", TotalRead.NONE, false),
    THIS_WEEK("this_week", TotalRead.NONE, false),
    LAST_WEEK("last_week", TotalRead.NONE, false),
    THIS_MONTH("this_month", TotalRead.NONE, true),
    LAST_MONTH("last_month", TotalRead.NONE, true),
    THIS_YEAR("this_year", TotalRead.WINDOW, true),
    LAST_YEAR("last_year", TotalRead.WINDOW, true),
    ALL_TIME("all_time", TotalRead.ALL, true);

    enum TotalRead {
        NONE,
        WINDOW,
        ALL
    }

    private final String wireName;
    private final TotalRead totalRead;
    private final boolean readsMedium;

    ScoreBucket(String wireName, TotalRead totalRead, boolean readsMedium) {
        this.wireName = wireName;
        this.totalRead = totalRead;
        this.readsMedium = readsMedium;
    }

    public String wireName() {
        return wireName;
    }

    public boolean readsMedium() {
        return readsMedium;
    }

    TotalRead totalRead() {
        return totalRead;
    }

    public TimeWindow interval(Instant now, TallyCalendar calendar, Instant epoch) {
        LocalDate today = calendar.localDate(now);
        return switch (this) {
            case TODAY -> days(calendar, today, today.plusDays(1));
            case YESTERDAY -> days(calendar, today.minusDays(1), today);
            case THIS_WEEK -> {
                LocalDate monday = calendar.firstOfWeek(now);
                yield days(calendar, monday, monday.plusWeeks(1));
            }
            case LAST_WEEK -> {
                LocalDate monday = calendar.firstOfWeek(now);
                yield days(calendar, monday.minusWeeks(1), monday);
            }
            case THIS_MONTH -> {
                LocalDate first = calendar.firstOfMonth(now);
                yield days(calendar, first, first.plusMonths(1));
            }
            case LAST_MONTH -> {
                LocalDate first = calendar.firstOfMonth(now);
                yield days(calendar, first.minusMonths(1), first);
            }
            case THIS_YEAR -> {
                LocalDate first = calendar.firstOfYear(now);
                yield days(calendar, first, first.plusYears(1));
            }
            case LAST_YEAR -> {
                LocalDate first = calendar.firstOfYear(now);
                yield days(calendar, first.minusYears(1), first);
            }
            case ALL_TIME -> new TimeWindow(epoch, calendar.startOf(today.plusDays(1)));
        };
    }

    private static TimeWindow days(TallyCalendar calendar, LocalDate fromInclusive, LocalDate toExclusive) {
        return new TimeWindow(calendar.startOf(fromInclusive), calendar.startOf(toExclusive));
    }
}
