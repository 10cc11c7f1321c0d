package com.tally.service.core.rollup;

import com.tally.service.core.counter.CounterType;
import java.time.Instant;

/**
 * Summed source rows of one (subject, scope, type) drained from a tier, for one destination bucket.
 *
 * @param bucket start of the month (daily drain) or year (monthly drain) the rows belong to
 * @param sourceRows how many source rows were folded into {@code total}
 */
public record TierRow(long subjectId, long scopeId, CounterType type, Instant bucket, long total, int sourceRows) {}
