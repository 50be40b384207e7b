/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single pattern-based text transformation.
 *
 * <p>Rules are immutable; every change produces a copy through one of the
 * {@code with*} methods. Identity is {@link #ruleId()}.
 */
public record Rule(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("type") RuleType type,
    @JsonProperty("pattern") String pattern,
    @JsonProperty("replacement") String replacement,
    @JsonProperty("priority") int priority,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("description") String description,
    @JsonProperty("performance_score") double performanceScore,
    @JsonProperty("usage_count") long usageCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) implements Serializable {

    public Rule {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(pattern, "pattern");
        if (replacement == null) replacement = "";
        if (description == null) description = "";
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }

    /**
     * Creates an enabled rule with no usage history.
     */
    public static Rule of(String ruleId, RuleType type, String pattern, String replacement,
                          int priority, String description) {
        return new Rule(ruleId, type, pattern, replacement, priority, true,
                description, 1.0, 0L, null, null);
    }

    public Rule withEnabled(boolean enabled, Instant at) {
        return new Rule(ruleId, type, pattern, replacement, priority, enabled,
                description, performanceScore, usageCount, createdAt, at);
    }

    /**
     * Copy with an improved pattern, as produced by an in-place patch.
     */
    public Rule withImprovedPattern(String newPattern, String newDescription,
                                    double newScore, Instant at) {
        return new Rule(ruleId, type, newPattern, replacement, priority, enabled,
                newDescription, newScore, usageCount, createdAt, at);
    }

    public Rule withUsageCount(long usageCount) {
        return new Rule(ruleId, type, pattern, replacement, priority, enabled,
                description, performanceScore, usageCount, createdAt, updatedAt);
    }
}
