/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

public record DryRunStats(
    @JsonProperty("sample_size") int sampleSize,
    @JsonProperty("failure_rate") double failureRate,
    @JsonProperty("avg_latency") Duration avgLatency,
    @JsonProperty("estimated_cost") double estimatedCost
) {
}
