package com.tally.service.core.score;

import com.tally.service.core.counter.CounterType;
import java.time.Instant;

/**
 * One total-tier row.
 *
 * @param lastWindowStart start of the most recent window promoted into the row
 * @param lastWindowCount what that window contributed
 */
public record TotalSnapshot(CounterType type, long count, Instant lastWindowStart, long lastWindowCount) {}
