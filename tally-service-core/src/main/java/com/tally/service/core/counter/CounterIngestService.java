package com.tally.service.core.counter;

import com.tally.service.core.calendar.TallyCalendar;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Buffered entry point for high-frequency events; the flush service writes them to the store. */
@Service
@RequiredArgsConstructor
public class CounterIngestService {

    private final CounterBuffer buffer;
    private final TallyCalendar calendar;
    private final Clock clock;

    public void record(long subjectId, long scopeId, CounterType type) {
        record(subjectId, scopeId, type, Instant.now(clock), 1);
    }

    public void record(long subjectId, long scopeId, CounterType type, Instant occurredAt, long delta) {
        Instant at = occurredAt != null ? occurredAt : Instant.now(clock);
        buffer.add(new FineCounterKey(subjectId, scopeId, type, calendar.dayBucket(at)), delta);
    }
}
