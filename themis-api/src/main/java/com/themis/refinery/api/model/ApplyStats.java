/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import java.util.List;
import java.util.Map;

/**
 * Statistics for one pass of the engine over one text.
 *
 * @param appliedRules rules that fired, in application order
 * @param typeCounts   number of fired rules per type
 */
public record ApplyStats(
    int originalLength,
    int finalLength,
    int appliedRuleCount,
    Map<RuleType, Integer> typeCounts,
    List<AppliedRule> appliedRules,
    double reductionRate
) {

    public ApplyStats {
        typeCounts = typeCounts == null ? Map.of() : Map.copyOf(typeCounts);
        appliedRules = appliedRules == null ? List.of() : List.copyOf(appliedRules);
    }

    public static ApplyStats unchanged(int length) {
        return new ApplyStats(length, length, 0, Map.of(), List.of(), 0.0);
    }
}
