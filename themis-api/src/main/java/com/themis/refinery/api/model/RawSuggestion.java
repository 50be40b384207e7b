/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Rule improvement proposal exactly as the evaluator reported it.
 *
 * <p>Nothing here is validated yet: the rule type is a free string and the
 * confidence may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawSuggestion(
    @JsonProperty("description") String description,
    @JsonProperty("confidence_score") Double confidenceScore,
    @JsonProperty("rule_type") String ruleType,
    @JsonProperty("pattern_before") String patternBefore,
    @JsonProperty("pattern_after") String patternAfter,
    @JsonProperty("estimated_improvement") String estimatedImprovement,
    @JsonProperty("applicable_cases") List<String> applicableCases
) {

    public RawSuggestion {
        applicableCases = applicableCases == null ? List.of() : List.copyOf(applicableCases);
    }
}
