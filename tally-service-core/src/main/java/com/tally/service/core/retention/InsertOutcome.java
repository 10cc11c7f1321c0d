package com.tally.service.core.retention;

/**
 * Result of appending to a bounded log.
 *
 * @param entryId id of the stored entry, or {@code -1} when the insert was skipped as a duplicate
 * @param trimmed entries deleted to restore the cap
 */
public record InsertOutcome(boolean stored, long entryId, int trimmed) {

    static InsertOutcome duplicate() {
        return new InsertOutcome(false, -1L, 0);
    }
}
