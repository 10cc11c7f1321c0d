package com.tally.service.core.rollup;

import com.tally.service.core.calendar.TimeWindow;
import java.util.List;

/**
 * Outcome of one rollup transaction.
 *
 * @param window the period the run was for; older leftover rows are promoted along with it
 * @param keys destination rows written, one per (subject, scope, type) and bucket
 * @param sourceRows source rows deleted
 * @param mass counts moved; equal to what the destination tier gained
 */
public record RollupResult(RollupPeriod period, TimeWindow window, int keys, long sourceRows, long mass) {

    static RollupResult of(RollupPeriod period, TimeWindow window, List<TierRow> rows) {
        long sourceRows = 0;
        long mass = 0;
        for (TierRow row : rows) {
            sourceRows += row.sourceRows();
            mass += row.total();
        }
        return new RollupResult(period, window, rows.size(), sourceRows, mass);
    }

    public boolean isEmpty() {
        return keys == 0;
    }
}
