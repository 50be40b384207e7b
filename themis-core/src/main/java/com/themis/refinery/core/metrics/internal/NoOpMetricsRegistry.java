package com.themis.refinery.core.metrics.internal;

import com.themis.refinery.core.metrics.Counter;
import com.themis.refinery.core.metrics.Gauge;
import com.themis.refinery.core.metrics.MetricsRegistry;
import com.themis.refinery.core.metrics.Timer;

import java.time.Duration;

/**
 * Fallback used when no provider is on the class path.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter NO_OP_COUNTER = new Counter() {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    };
    private static final Gauge NO_OP_GAUGE = new Gauge() {
        public void set(double value) {}
        public double value() { return 0.0; }
    };
    private static final Timer NO_OP_TIMER = (Duration duration) -> {};

    @Override
    public Counter counter(String name, String... tags) {
        return NO_OP_COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return NO_OP_GAUGE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return NO_OP_TIMER;
    }
}
