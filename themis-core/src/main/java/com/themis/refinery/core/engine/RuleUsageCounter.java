package com.themis.refinery.core.engine;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Accumulates how often each rule actually changed a text.
 *
 * <p>Rules are immutable while a batch runs, so usage is gathered here and
 * folded into the store between batches via {@link #drain()}.
 */
public final class RuleUsageCounter {

    private final ConcurrentHashMap<String, LongAdder> counts = new ConcurrentHashMap<>();

    public void record(String ruleId) {
        counts.computeIfAbsent(ruleId, id -> new LongAdder()).increment();
    }

    public long count(String ruleId) {
        LongAdder adder = counts.get(ruleId);
        return adder != null ? adder.sum() : 0L;
    }

    /**
     * Returns the accumulated counts and resets them. Call only when no batch
     * is in flight.
     */
    public Map<String, Long> drain() {
        Map<String, Long> drained = new HashMap<>();
        for (String ruleId : counts.keySet()) {
            LongAdder adder = counts.remove(ruleId);
            if (adder != null && adder.sum() > 0) {
                drained.put(ruleId, adder.sum());
            }
        }
        return drained;
    }
}
