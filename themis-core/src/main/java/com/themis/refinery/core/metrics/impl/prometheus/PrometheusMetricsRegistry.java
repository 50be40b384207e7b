package com.themis.refinery.core.metrics.impl.prometheus;

import com.themis.refinery.core.metrics.Counter;
import com.themis.refinery.core.metrics.Gauge;
import com.themis.refinery.core.metrics.MetricsRegistry;
import com.themis.refinery.core.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus simpleclient backend.
 *
 * <p>One collector is registered per metric name, with label names taken
 * from the first use; each distinct label-value combination gets its own
 * child. Thread-safe.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] LATENCY_BUCKETS = {0.001, 0.01, 0.1, 0.5, 1.0, 5.0, 10.0, 30.0, 60.0};

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counterCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gaugeCollectors = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histogramCollectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Counter collector = counterCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Counter.build()
                            .name(sanitizeName(n) + "_total")
                            .help("Counter " + n)
                            .labelNames(labelNames(tags))
                            .register(registry));
            io.prometheus.client.Counter.Child child = collector.labels(labelValues(tags));
            return new Counter() {
                @Override
                public void increment() {
                    child.inc();
                }

                @Override
                public void increment(long amount) {
                    if (amount < 0) {
                        throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
                    }
                    child.inc(amount);
                }

                @Override
                public long count() {
                    return (long) child.get();
                }
            };
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Gauge collector = gaugeCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Gauge " + n)
                            .labelNames(labelNames(tags))
                            .register(registry));
            io.prometheus.client.Gauge.Child child = collector.labels(labelValues(tags));
            return new Gauge() {
                @Override
                public void set(double value) {
                    child.set(value);
                }

                @Override
                public double value() {
                    return child.get();
                }
            };
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> {
            Histogram collector = histogramCollectors.computeIfAbsent(name, n ->
                    Histogram.build()
                            .name(sanitizeName(n) + "_seconds")
                            .help("Timer " + n)
                            .buckets(LATENCY_BUCKETS)
                            .labelNames(labelNames(tags))
                            .register(registry));
            Histogram.Child child = collector.labels(labelValues(tags));
            return (Duration duration) -> child.observe(duration.toNanos() / 1_000_000_000.0);
        });
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String key(String name, String... tags) {
        return tags.length == 0 ? name : name + Arrays.toString(tags);
    }

    private static String[] labelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] labelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}
