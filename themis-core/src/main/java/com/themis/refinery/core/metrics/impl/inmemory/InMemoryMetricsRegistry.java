package com.themis.refinery.core.metrics.impl.inmemory;

import com.themis.refinery.core.metrics.Counter;
import com.themis.refinery.core.metrics.Gauge;
import com.themis.refinery.core.metrics.MetricsRegistry;
import com.themis.refinery.core.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry that keeps every value in memory, for tests and local runs.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * metrics.counter("themis_alerts", "severity", "WARNING").increment();
 * assertThat(metrics.getCounterValue("themis_alerts", "severity", "WARNING")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        InMemoryGauge gauge = gauges.get(key(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.recordings() : Collections.emptyList();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    private static String key(String name, String... tags) {
        return tags.length == 0 ? name : name + Arrays.toString(tags);
    }

    private static final class InMemoryCounter implements Counter {
        private final AtomicLong value = new AtomicLong();

        @Override
        public void increment() {
            value.incrementAndGet();
        }

        @Override
        public void increment(long amount) {
            value.addAndGet(amount);
        }

        @Override
        public long count() {
            return value.get();
        }
    }

    private static final class InMemoryGauge implements Gauge {
        private volatile double value;

        @Override
        public void set(double value) {
            this.value = value;
        }

        @Override
        public double value() {
            return value;
        }
    }

    private static final class InMemoryTimer implements Timer {
        private final List<Duration> recordings = new CopyOnWriteArrayList<>();

        @Override
        public void record(Duration duration) {
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Cannot record negative duration: " + duration);
            }
            recordings.add(duration);
        }

        List<Duration> recordings() {
            return Collections.unmodifiableList(new ArrayList<>(recordings));
        }
    }
}
