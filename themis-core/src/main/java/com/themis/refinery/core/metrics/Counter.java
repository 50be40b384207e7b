package com.themis.refinery.core.metrics;

/**
 * Monotonically increasing count. Thread-safe.
 */
public interface Counter {
    void increment();

    void increment(long amount);

    long count();
}
