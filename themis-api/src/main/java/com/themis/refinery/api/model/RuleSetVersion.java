/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named, immutable snapshot of the whole rule set.
 *
 * <p>Rule order inside the snapshot carries no meaning; the engine always
 * re-sorts by priority.
 */
public record RuleSetVersion(
    @JsonProperty("version") String version,
    @JsonProperty("rules") List<Rule> rules,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("is_stable") boolean stable,
    @JsonProperty("performance_snapshot") Map<String, Double> performanceSnapshot,
    @JsonProperty("parent_version") String parentVersion,
    @JsonProperty("description") String description
) {

    public RuleSetVersion {
        Objects.requireNonNull(version, "version");
        rules = rules == null ? List.of() : List.copyOf(rules);
        performanceSnapshot = performanceSnapshot == null ? Map.of() : Map.copyOf(performanceSnapshot);
        if (createdAt == null) createdAt = Instant.now();
        if (description == null) description = "";
    }

    public RuleSetVersion withRules(List<Rule> newRules) {
        return new RuleSetVersion(version, newRules, createdAt, stable,
                performanceSnapshot, parentVersion, description);
    }

    public long enabledRuleCount() {
        return rules.stream().filter(Rule::enabled).count();
    }
}
