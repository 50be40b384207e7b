/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Validated, deduplicated candidate patch. Ephemeral: only the patch
 * history keeps a trace of it once applied.
 */
public record PatchSuggestion(
    @JsonProperty("suggestion_id") String suggestionId,
    @JsonProperty("description") String description,
    @JsonProperty("rule_type") RuleType ruleType,
    @JsonProperty("confidence_score") double confidenceScore,
    @JsonProperty("pattern_before") String patternBefore,
    @JsonProperty("pattern_after") String patternAfter,
    @JsonProperty("estimated_improvement") String estimatedImprovement,
    @JsonProperty("applicable_cases") List<String> applicableCases,
    @JsonProperty("created_at") Instant createdAt
) {

    public PatchSuggestion {
        if (patternBefore == null) patternBefore = "";
        if (patternAfter == null) patternAfter = "";
        if (estimatedImprovement == null) estimatedImprovement = "";
        applicableCases = applicableCases == null ? List.of() : List.copyOf(applicableCases);
        if (createdAt == null) createdAt = Instant.now();
    }

    /**
     * The pattern a rule built from this suggestion would carry:
     * {@code pattern_after} when present, otherwise {@code pattern_before}.
     */
    @JsonIgnore
    public String targetPattern() {
        return patternAfter.isBlank() ? patternBefore : patternAfter;
    }
}
