package com.tally.service.core.counter;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/** Identity of a daily counter row. {@code dayBucket} is already aligned to the calendar frame. */
public record FineCounterKey(long subjectId, long scopeId, CounterType type, Instant dayBucket) {

    public static final Comparator<FineCounterKey> LOCK_ORDER = Comparator.comparingLong(FineCounterKey::subjectId)
            .thenComparingLong(FineCounterKey::scopeId)
            .thenComparing(FineCounterKey::type)
            .thenComparing(FineCounterKey::dayBucket);

    public FineCounterKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(dayBucket, "dayBucket");
    }
}
