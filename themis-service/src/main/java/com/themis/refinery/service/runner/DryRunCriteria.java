/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds a dry run must meet before full processing unlocks.
 */
public record DryRunCriteria(double maxFailureRate, Duration maxAvgLatency, double costBudget) {

    public static final double DEFAULT_MAX_FAILURE_RATE = 0.05;
    public static final Duration DEFAULT_MAX_AVG_LATENCY = Duration.ofSeconds(10);

    public DryRunCriteria {
        if (maxFailureRate < 0.0 || maxFailureRate > 1.0) {
            throw new IllegalArgumentException("maxFailureRate must be between 0.0 and 1.0");
        }
        if (costBudget < 0.0) {
            throw new IllegalArgumentException("costBudget must not be negative");
        }
    }

    public static DryRunCriteria withBudget(double costBudget) {
        return new DryRunCriteria(DEFAULT_MAX_FAILURE_RATE, DEFAULT_MAX_AVG_LATENCY, costBudget);
    }

    public DryRunVerdict evaluate(DryRunStats stats) {
        List<String> reasons = new ArrayList<>();
        if (stats.failureRate() > maxFailureRate) {
            reasons.add(String.format("failure rate %.3f exceeds %.3f", stats.failureRate(), maxFailureRate));
        }
        if (stats.avgLatency().compareTo(maxAvgLatency) > 0) {
            reasons.add(String.format("average latency %d ms exceeds %d ms",
                    stats.avgLatency().toMillis(), maxAvgLatency.toMillis()));
        }
        if (stats.estimatedCost() > costBudget) {
            reasons.add(String.format("estimated cost $%.2f exceeds budget $%.2f", stats.estimatedCost(), costBudget));
        }
        return new DryRunVerdict(reasons.isEmpty(), stats, reasons);
    }
}
