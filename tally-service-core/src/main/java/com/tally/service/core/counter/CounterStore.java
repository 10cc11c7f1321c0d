package com.tally.service.core.counter;

import java.time.Instant;
import java.util.List;

/**
 * Daily counter tier. The only mutation exposed to callers is an additive increment; promotion to
 * the monthly and total tiers belongs to the rollup.
 */
public interface CounterStore {

    /** Adds {@code delta} to the row for the day containing {@code timestamp}, creating it if absent. */
    void increment(long subjectId, long scopeId, CounterType type, Instant timestamp, long delta);

    /** Applies already-aligned deltas in one transaction. */
    void incrementBatch(List<CounterDelta> deltas);
}
