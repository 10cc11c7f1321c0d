package com.tally.service.core.support;

import com.tally.service.core.retention.HistoryLogType;

/** Advisory lock keys shared between writers and the rollup. */
public final class StoreLocks {

    /** Increments hold it shared for their transaction, a rollup holds it exclusively. */
    public static final long ROLLUP_GUARD_KEY = 0x74616C6C79L;

    private static final long RETENTION_NAMESPACE = 0x5245544EL << 24;

    private StoreLocks() {}

    /** Per-(subject, log type) key serialising inserts into one bounded log. */
    public static long retentionKey(long subjectId, HistoryLogType logType) {
        return (RETENTION_NAMESPACE ^ (subjectId * 31L)) + logType.ordinal();
    }
}
