package com.tally.service.core.rollup;

import java.time.Instant;
import java.util.List;

/**
 * Tier promotion primitives. Each drain deletes the source rows it returns, so callers must run
 * drain and add in one transaction. Drains take every row before the cutoff, so rows a missed or
 * aborted run left behind are promoted by the next one into their own buckets.
 */
public interface RollupRepository {

    /** Waits out in-flight increments and blocks new ones until the transaction ends. */
    void acquireRollupGuard();

    /** Daily rows before {@code before}, summed per key and calendar month. */
    List<TierRow> drainFine(Instant before);

    void addMedium(List<TierRow> rows);

    /** Monthly rows before {@code before}, summed per key and calendar year. */
    List<TierRow> drainMedium(Instant before);

    /**
     * Adds to the total tier. A row's bucket becomes its latest promoted window unless a later year was
     * already promoted; rows of one key must arrive in ascending bucket order.
     */
    void addTotal(List<TierRow> rows);
}
