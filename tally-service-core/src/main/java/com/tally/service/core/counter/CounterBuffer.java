package com.tally.service.core.counter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/** Coalesces increments per daily counter key until the next flush. */
@Component
public class CounterBuffer {

    private final ConcurrentMap<FineCounterKey, Long> pending = new ConcurrentHashMap<>();

    public void add(FineCounterKey key, long delta) {
        if (delta == 0) {
            return;
        }
        pending.merge(key, delta, Long::sum);
    }

    /** Removes and returns everything buffered so far; increments racing with the drain land in the next one. */
    public List<CounterDelta> drain() {
        List<CounterDelta> drained = new ArrayList<>(pending.size());
        for (FineCounterKey key : pending.keySet()) {
            Long value = pending.remove(key);
            if (value != null && value != 0) {
                drained.add(new CounterDelta(key, value));
            }
        }
        return drained;
    }

    public void requeue(List<CounterDelta> deltas) {
        for (CounterDelta delta : deltas) {
            add(delta.key(), delta.delta());
        }
    }

    public int size() {
        return pending.size();
    }
}
