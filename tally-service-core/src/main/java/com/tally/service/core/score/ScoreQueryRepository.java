package com.tally.service.core.score;

import com.tally.service.core.counter.CounterType;
import java.time.Instant;
import java.util.List;

/** Read side of the three counter tiers. A {@code null} type reads every counter type. */
public interface ScoreQueryRepository {

    List<BucketCount> fineByDay(long subjectId, long scopeId, CounterType type, Instant from);

    List<BucketCount> mediumByMonth(long subjectId, long scopeId, CounterType type, Instant from);

    List<TotalSnapshot> totals(long subjectId, long scopeId, CounterType type);
}
