package com.themis.refinery.core.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency distribution. Thread-safe.
 */
public interface Timer {

    void record(Duration duration);

    /**
     * Times the callable and records its duration, also when it throws.
     */
    default <T> T record(Callable<T> callable) throws Exception {
        long start = System.nanoTime();
        try {
            return callable.call();
        } finally {
            record(Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
