/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.corpus;

import com.themis.refinery.gates.QualityThresholds;
import com.themis.refinery.service.processing.CaseEvaluation;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups evaluator-reported failures by {@link FailurePattern}, largest
 * cluster first. A case that fell short of the quality thresholds without
 * naming an error contributes its threshold violations instead.
 */
public final class FailureClusterer {

    static final int SAMPLE_ERRORS = 5;

    private final QualityThresholds thresholds;

    public FailureClusterer(QualityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<FailureCluster> cluster(List<CaseEvaluation> evaluations) {
        Object2IntOpenHashMap<FailurePattern> counts = new Object2IntOpenHashMap<>();
        Map<FailurePattern, Set<String>> cases = new EnumMap<>(FailurePattern.class);
        Map<FailurePattern, List<String>> samples = new EnumMap<>(FailurePattern.class);

        for (CaseEvaluation evaluation : evaluations) {
            if (!evaluation.hasProblems()) {
                continue;
            }
            for (String error : errorsOf(evaluation)) {
                FailurePattern pattern = FailurePattern.classify(error);
                counts.addTo(pattern, 1);
                cases.computeIfAbsent(pattern, p -> new LinkedHashSet<>()).add(evaluation.caseId());
                List<String> sample = samples.computeIfAbsent(pattern, p -> new ArrayList<>());
                if (sample.size() < SAMPLE_ERRORS) {
                    sample.add(error);
                }
            }
        }

        List<FailureCluster> clusters = new ArrayList<>(counts.size());
        for (Object2IntMap.Entry<FailurePattern> entry : counts.object2IntEntrySet()) {
            FailurePattern pattern = entry.getKey();
            clusters.add(new FailureCluster(pattern, entry.getIntValue(),
                    new ArrayList<>(cases.get(pattern)), samples.get(pattern)));
        }
        clusters.sort(Comparator.comparingInt(FailureCluster::failureCount).reversed()
                .thenComparingInt(cluster -> cluster.pattern().ordinal()));
        return clusters;
    }

    private List<String> errorsOf(CaseEvaluation evaluation) {
        if (!evaluation.errors().isEmpty()) {
            return evaluation.errors();
        }
        if (evaluation.isFailed()) {
            return List.of(evaluation.failure());
        }
        List<String> violations = thresholds.violations(evaluation.metrics());
        return violations.isEmpty() ? List.of("unspecified quality issue") : violations;
    }
}
