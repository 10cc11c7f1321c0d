package com.tally.service.core.testsupport;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.counter.CounterDelta;
import com.tally.service.core.counter.CounterStore;
import com.tally.service.core.counter.CounterType;
import com.tally.service.core.counter.FineCounterKey;
import com.tally.service.core.rollup.RollupRepository;
import com.tally.service.core.rollup.TierRow;
import com.tally.service.core.score.BucketCount;
import com.tally.service.core.score.ScoreQueryRepository;
import com.tally.service.core.score.TotalSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** The three counter tiers held in maps, with snapshot and restore standing in for rollback. */
public final class InMemoryTallyStore implements CounterStore, RollupRepository, ScoreQueryRepository {

    public record TierKey(long subjectId, long scopeId, CounterType type) {}

    public record MediumKey(TierKey key, Instant monthBucket) {}

    public record TotalRow(long count, Instant lastWindowStart, long lastWindowCount) {}

    public record Snapshot(Map<FineCounterKey, Long> fine, Map<MediumKey, Long> medium, Map<TierKey, TotalRow> total) {}

    private final TallyCalendar calendar;
    private Map<FineCounterKey, Long> fine = new TreeMap<>(FineCounterKey.LOCK_ORDER);
    private Map<MediumKey, Long> medium = new HashMap<>();
    private Map<TierKey, TotalRow> total = new HashMap<>();

    private RuntimeException failOnAddMedium;
    private RuntimeException failOnAddTotal;
    private int guardAcquisitions;

    public InMemoryTallyStore(TallyCalendar calendar) {
        this.calendar = calendar;
    }

    public synchronized Snapshot snapshot() {
        Map<FineCounterKey, Long> fineCopy = new TreeMap<>(FineCounterKey.LOCK_ORDER);
        fineCopy.putAll(fine);
        return new Snapshot(fineCopy, new HashMap<>(medium), new HashMap<>(total));
    }

    public synchronized void restore(Snapshot snapshot) {
        fine = new TreeMap<>(FineCounterKey.LOCK_ORDER);
        fine.putAll(snapshot.fine());
        medium = new HashMap<>(snapshot.medium());
        total = new HashMap<>(snapshot.total());
    }

    public void failOnAddMedium(RuntimeException failure) {
        this.failOnAddMedium = failure;
    }

    public void failOnAddTotal(RuntimeException failure) {
        this.failOnAddTotal = failure;
    }

    public int guardAcquisitions() {
        return guardAcquisitions;
    }

    public synchronized Map<FineCounterKey, Long> fineRows() {
        return Map.copyOf(fine);
    }

    public synchronized Map<MediumKey, Long> mediumRows() {
        return Map.copyOf(medium);
    }

    public synchronized Map<TierKey, TotalRow> totalRows() {
        return Map.copyOf(total);
    }

    /** Sum of every tier for one key; unchanged by any rollup. */
    public synchronized long mass(long subjectId, long scopeId, CounterType type) {
        TierKey key = new TierKey(subjectId, scopeId, type);
        long sum = 0;
        for (Map.Entry<FineCounterKey, Long> e : fine.entrySet()) {
            if (tierKey(e.getKey()).equals(key)) {
                sum += e.getValue();
            }
        }
        for (Map.Entry<MediumKey, Long> e : medium.entrySet()) {
            if (e.getKey().key().equals(key)) {
                sum += e.getValue();
            }
        }
        TotalRow row = total.get(key);
        return row != null ? sum + row.count() : sum;
    }

    @Override
    public synchronized void increment(long subjectId, long scopeId, CounterType type, Instant timestamp, long delta) {
        fine.merge(new FineCounterKey(subjectId, scopeId, type, calendar.dayBucket(timestamp)), delta, Long::sum);
    }

    @Override
    public synchronized void incrementBatch(List<CounterDelta> deltas) {
        for (CounterDelta delta : deltas) {
            fine.merge(delta.key(), delta.delta(), Long::sum);
        }
    }

    @Override
    public synchronized void acquireRollupGuard() {
        guardAcquisitions++;
    }

    @Override
    public synchronized List<TierRow> drainFine(Instant before) {
        Map<MediumKey, long[]> sums = new TreeMap<>(DRAIN_ORDER);
        Iterator<Map.Entry<FineCounterKey, Long>> it = fine.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<FineCounterKey, Long> e = it.next();
            if (e.getKey().dayBucket().isBefore(before)) {
                MediumKey group = new MediumKey(tierKey(e.getKey()), calendar.monthBucket(e.getKey().dayBucket()));
                long[] acc = sums.computeIfAbsent(group, k -> new long[2]);
                acc[0] += e.getValue();
                acc[1]++;
                it.remove();
            }
        }
        return rows(sums);
    }

    @Override
    public synchronized void addMedium(List<TierRow> rows) {
        if (failOnAddMedium != null) {
            throw failOnAddMedium;
        }
        for (TierRow row : rows) {
            medium.merge(new MediumKey(tierKey(row), row.bucket()), row.total(), Long::sum);
        }
    }

    @Override
    public synchronized List<TierRow> drainMedium(Instant before) {
        Map<MediumKey, long[]> sums = new TreeMap<>(DRAIN_ORDER);
        Iterator<Map.Entry<MediumKey, Long>> it = medium.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<MediumKey, Long> e = it.next();
            if (e.getKey().monthBucket().isBefore(before)) {
                // the bucket slot of the grouping key holds the year start here
                Instant yearBucket = calendar.startOf(calendar.firstOfYear(e.getKey().monthBucket()));
                long[] acc = sums.computeIfAbsent(new MediumKey(e.getKey().key(), yearBucket), k -> new long[2]);
                acc[0] += e.getValue();
                acc[1]++;
                it.remove();
            }
        }
        return rows(sums);
    }

    @Override
    public synchronized void addTotal(List<TierRow> rows) {
        if (failOnAddTotal != null) {
            throw failOnAddTotal;
        }
        for (TierRow row : rows) {
            TierKey key = tierKey(row);
            TotalRow existing = total.get(key);
            if (existing == null) {
                total.put(key, new TotalRow(row.total(), row.bucket(), row.total()));
                continue;
            }
            Instant lastStart = existing.lastWindowStart();
            long count = existing.count() + row.total();
            if (row.bucket().equals(lastStart)) {
                total.put(key, new TotalRow(count, lastStart, existing.lastWindowCount() + row.total()));
            } else if (lastStart == null || row.bucket().isAfter(lastStart)) {
                total.put(key, new TotalRow(count, row.bucket(), row.total()));
            } else {
                total.put(key, new TotalRow(count, lastStart, existing.lastWindowCount()));
            }
        }
    }

    @Override
    public synchronized List<BucketCount> fineByDay(long subjectId, long scopeId, CounterType type, Instant from) {
        Map<Instant, Long> byDay = new TreeMap<>();
        fine.forEach((key, value) -> {
            if (key.subjectId() == subjectId
                    && key.scopeId() == scopeId
                    && (type == null || key.type() == type)
                    && !key.dayBucket().isBefore(from)) {
                byDay.merge(key.dayBucket(), value, Long::sum);
            }
        });
        return buckets(byDay);
    }

    @Override
    public synchronized List<BucketCount> mediumByMonth(long subjectId, long scopeId, CounterType type, Instant from) {
        Map<Instant, Long> byMonth = new TreeMap<>();
        medium.forEach((key, value) -> {
            TierKey k = key.key();
            if (k.subjectId() == subjectId
                    && k.scopeId() == scopeId
                    && (type == null || k.type() == type)
                    && !key.monthBucket().isBefore(from)) {
                byMonth.merge(key.monthBucket(), value, Long::sum);
            }
        });
        return buckets(byMonth);
    }

    @Override
    public synchronized List<TotalSnapshot> totals(long subjectId, long scopeId, CounterType type) {
        List<TotalSnapshot> result = new ArrayList<>();
        total.forEach((key, row) -> {
            if (key.subjectId() == subjectId && key.scopeId() == scopeId && (type == null || key.type() == type)) {
                result.add(new TotalSnapshot(key.type(), row.count(), row.lastWindowStart(), row.lastWindowCount()));
            }
        });
        return result;
    }

    private static final Comparator<MediumKey> DRAIN_ORDER = Comparator.comparingLong(
                    (MediumKey k) -> k.key().subjectId())
            .thenComparingLong(k -> k.key().scopeId())
            .thenComparing(k -> k.key().type())
            .thenComparing(MediumKey::monthBucket);

    private static TierKey tierKey(FineCounterKey key) {
        return new TierKey(key.subjectId(), key.scopeId(), key.type());
    }

    private static TierKey tierKey(TierRow row) {
        return new TierKey(row.subjectId(), row.scopeId(), row.type());
    }

    private static List<TierRow> rows(Map<MediumKey, long[]> sums) {
        List<TierRow> rows = new ArrayList<>(sums.size());
        sums.forEach((group, acc) -> rows.add(new TierRow(
                group.key().subjectId(),
                group.key().scopeId(),
                group.key().type(),
                group.monthBucket(),
                acc[0],
                (int) acc[1])));
        return rows;
    }

    private static List<BucketCount> buckets(Map<Instant, Long> sums) {
        List<BucketCount> result = new ArrayList<>(sums.size());
        sums.forEach((bucket, count) -> result.add(new BucketCount(bucket, count)));
        return result;
    }
}
