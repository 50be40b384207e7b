/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one safety gate against one candidate rule set.
 */
public record GateResult(
    @JsonProperty("gate_type") GateType gateType,
    @JsonProperty("passed") boolean passed,
    @JsonProperty("score") double score,
    @JsonProperty("details") Map<String, Object> details,
    @JsonProperty("error") String error
) {

    public GateResult {
        Objects.requireNonNull(gateType, "gateType");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static GateResult passed(GateType type, double score, Map<String, Object> details) {
        return new GateResult(type, true, score, details, null);
    }

    public static GateResult failed(GateType type, double score, Map<String, Object> details) {
        return new GateResult(type, false, score, details, null);
    }

    /**
     * Result for a gate that threw while executing.
     */
    public static GateResult errored(GateType type, String error) {
        return new GateResult(type, false, 0.0, Map.of("error", error), error);
    }
}
