package com.tally.service.core.retention;

import java.util.Comparator;

/**
 * Order among history entries sharing a timestamp. Entries are ranked newest timestamp first; the
 * policy decides which insertion counts as more recent when timestamps are equal.
 */
public enum TieBreakPolicy {
    /** The later insertion ranks first, so it survives a trim. */
    NEWEST_INSERT_FIRST("recorded_at desc, id desc"),
    /** The earlier insertion ranks first; a late arrival with an equal timestamp is trimmed first. */
    OLDEST_INSERT_FIRST("recorded_at desc, id asc");

    private final String orderBy;

    TieBreakPolicy(String orderBy) {
        this.orderBy = orderBy;
    }

    public String orderBy() {
        return orderBy;
    }

    /** Most recent first, matching {@link #orderBy()}. */
    public Comparator<StoredHistoryEntry> ranking() {
        Comparator<StoredHistoryEntry> byTime =
                Comparator.comparing(StoredHistoryEntry::recordedAt).reversed();
        Comparator<StoredHistoryEntry> byId = Comparator.comparingLong(StoredHistoryEntry::id);
        return this == NEWEST_INSERT_FIRST ? byTime.thenComparing(byId.reversed()) : byTime.thenComparing(byId);
    }
}
