package com.tally.service.core.score;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.calendar.TimeWindow;
import com.tally.service.core.config.TallyProperties;
import com.tally.service.core.counter.CounterType;
import com.tally.service.core.support.StoreErrors;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Computes scores across the live and rolled-up tiers. A count sits in exactly one tier at any time,
 * so month, year and all-time buckets read the same before and after a rollup. The three tiers are
 * read from one snapshot.
 */
@Slf4j
@Service
public class ScoreQueryService {

    private final ScoreQueryRepository repository;
    private final TransactionTemplate readTemplate;
    private final TallyCalendar calendar;
    private final TallyProperties properties;
    private final Clock clock;

    public ScoreQueryService(
            ScoreQueryRepository repository,
            PlatformTransactionManager transactionManager,
            TallyCalendar calendar,
            TallyProperties properties,
            Clock clock) {
        this.repository = repository;
        this.calendar = calendar;
        this.properties = properties;
        this.clock = clock;
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setName("tally-score");
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
    }

    public Score getScore(long subjectId, long scopeId) {
        return getScore(subjectId, scopeId, null);
    }

    /** @param type restricts the score to one counter type; {@code null} sums every type */
    public Score getScore(long subjectId, long scopeId, CounterType type) {
        return getScore(subjectId, scopeId, type, Instant.now(clock));
    }

    Score getScore(long subjectId, long scopeId, CounterType type, Instant now) {
        Instant epoch = properties.getScore().getEpoch();
        Map<ScoreBucket, TimeWindow> windows = new EnumMap<>(ScoreBucket.class);
        Instant from = epoch;
        for (ScoreBucket bucket : ScoreBucket.values()) {
            TimeWindow window = bucket.interval(now, calendar, epoch);
            windows.put(bucket, window);
            if (window.start().isBefore(from)) {
                from = window.start();
            }
        }

        Instant since = from;
        TierReads reads;
        try {
            reads = readTemplate.execute(status -> new TierReads(
                    repository.fineByDay(subjectId, scopeId, type, since),
                    repository.mediumByMonth(subjectId, scopeId, type, since),
                    repository.totals(subjectId, scopeId, type)));
        } catch (RuntimeException ex) {
            throw StoreErrors.translate("Score query subject=" + subjectId + " scope=" + scopeId, ex);
        }

        Map<ScoreBucket, Long> counts = new EnumMap<>(ScoreBucket.class);
        windows.forEach(
                (bucket, window) -> counts.put(bucket, count(bucket, window, reads.fine(), reads.medium(), reads.totals())));
        log.debug("Score subject={} scope={} type={}: {}", subjectId, scopeId, type, counts);
        return Score.of(counts);
    }

    private static long count(
            ScoreBucket bucket,
            TimeWindow window,
            List<BucketCount> fine,
            List<BucketCount> medium,
            List<TotalSnapshot> totals) {
        long sum = sumWithin(window, fine);
        if (bucket.readsMedium()) {
            sum += sumWithin(window, medium);
        }
        switch (bucket.totalRead()) {
            case ALL -> {
                for (TotalSnapshot total : totals) {
                    sum += total.count();
                }
            }
            case WINDOW -> {
                for (TotalSnapshot total : totals) {
                    if (window.start().equals(total.lastWindowStart())) {
                        sum += total.lastWindowCount();
                    }
                }
            }
            case NONE -> {}
        }
        return sum;
    }

    private static long sumWithin(TimeWindow window, List<BucketCount> rows) {
        long sum = 0;
        for (BucketCount row : rows) {
            if (window.contains(row.bucket())) {
                sum += row.count();
            }
        }
        return sum;
    }

    private record TierReads(List<BucketCount> fine, List<BucketCount> medium, List<TotalSnapshot> totals) {}
}
