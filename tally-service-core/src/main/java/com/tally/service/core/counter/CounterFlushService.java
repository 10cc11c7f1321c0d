package com.tally.service.core.counter;

import com.tally.service.core.config.TallyProperties;
import com.tally.service.core.support.IntegrityViolationException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class CounterFlushService {

    private final CounterBuffer buffer;
    private final CounterStore counterStore;
    private final TallyProperties properties;

    private int maxBatchSize;

    private final Object flushLock = new Object();

    @PostConstruct
    void configureBatchSize() {
        this.maxBatchSize = Math.max(1, properties.getCounters().getFlush().getMaxBatchSize());
    }

    @Scheduled(fixedRateString = "${tally.counters.flush.rate-millis:10000}")
    public void flushScheduled() {
        try {
            flush();
        } catch (RuntimeException ex) {
            log.error("Counter flush failed; unwritten deltas were re-queued", ex);
        }
    }

    @PreDestroy
    void flushOnShutdown() {
        try {
            flush();
        } catch (RuntimeException ex) {
            log.error("Counter flush at shutdown failed; {} keys still buffered", buffer.size(), ex);
        }
    }

    /**
     * Writes the buffered deltas in chunks. A chunk the store rejects as an integrity violation is
     * split until the offending keys are isolated; those are dropped and the rest is written. Any
     * other failure puts every delta not yet written back into the buffer.
     */
    public int flush() {
        synchronized (flushLock) {
            List<CounterDelta> drained = buffer.drain();
            if (drained.isEmpty()) {
                return 0;
            }
            Deque<List<CounterDelta>> segments = new ArrayDeque<>();
            for (int i = 0; i < drained.size(); i += maxBatchSize) {
                segments.addLast(new ArrayList<>(drained.subList(i, Math.min(i + maxBatchSize, drained.size()))));
            }
            int written = 0;
            int rejected = 0;
            while (!segments.isEmpty()) {
                List<CounterDelta> segment = segments.pollFirst();
                try {
                    counterStore.incrementBatch(segment);
                    written += segment.size();
                } catch (IntegrityViolationException ex) {
                    if (segment.size() == 1) {
                        rejected++;
                        log.error("Dropping counter delta {} rejected by the store", segment.get(0), ex);
                    } else {
                        int half = segment.size() / 2;
                        segments.addFirst(new ArrayList<>(segment.subList(half, segment.size())));
                        segments.addFirst(new ArrayList<>(segment.subList(0, half)));
                    }
                } catch (RuntimeException ex) {
                    buffer.requeue(segment);
                    segments.forEach(buffer::requeue);
                    throw ex;
                }
            }
            if (rejected > 0) {
                log.warn("Flushed {} counter keys, dropped {}", written, rejected);
            } else {
                log.debug("Flushed {} counter keys", written);
            }
            return written;
        }
    }
}
