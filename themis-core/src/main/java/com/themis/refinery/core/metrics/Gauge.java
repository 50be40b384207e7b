package com.themis.refinery.core.metrics;

/**
 * Instantaneous value. Thread-safe.
 */
public interface Gauge {
    void set(double value);

    double value();
}
