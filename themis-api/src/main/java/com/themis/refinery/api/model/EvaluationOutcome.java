/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of one evaluator call.
 *
 * <p>A degraded outcome carries zero metrics and exactly one descriptive
 * error; it is produced instead of throwing when the evaluator times out or
 * answers with something unparseable.
 */
public record EvaluationOutcome(
    QualityMetrics metrics,
    List<String> errors,
    List<RawSuggestion> suggestions,
    boolean degraded
) {

    public EvaluationOutcome {
        Objects.requireNonNull(metrics, "metrics");
        errors = errors == null ? List.of() : List.copyOf(errors);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static EvaluationOutcome of(QualityMetrics metrics, List<String> errors,
                                       List<RawSuggestion> suggestions) {
        return new EvaluationOutcome(metrics, errors, suggestions, false);
    }

    public static EvaluationOutcome fallback(String error) {
        return new EvaluationOutcome(QualityMetrics.zero(), List.of(error), List.of(), true);
    }
}
