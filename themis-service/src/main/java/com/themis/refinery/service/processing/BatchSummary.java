/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.processing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.gates.MetricAverages;
import com.themis.refinery.gates.QualityThresholds;

import java.util.Collection;
import java.util.List;

/**
 * Order-independent aggregate of a batch of case evaluations. Averages cover
 * processed cases only; failed cases count towards the failure rate.
 */
public record BatchSummary(
    @JsonProperty("total") int total,
    @JsonProperty("failed") int failed,
    @JsonProperty("quality_passed") int qualityPassed,
    @JsonProperty("average") QualityMetrics average,
    @JsonProperty("avg_latency_ms") double avgLatencyMs,
    @JsonProperty("tokens_before") long tokensBefore,
    @JsonProperty("tokens_after") long tokensAfter
) {

    public static BatchSummary of(Collection<CaseEvaluation> evaluations) {
        List<QualityMetrics> processed = evaluations.stream()
                .filter(evaluation -> !evaluation.isFailed())
                .map(CaseEvaluation::metrics)
                .toList();
        int failed = evaluations.size() - processed.size();
        int qualityPassed = (int) evaluations.stream().filter(CaseEvaluation::meetsQuality).count();
        double avgLatency = evaluations.stream().mapToLong(CaseEvaluation::latencyMs).average().orElse(0.0);
        long tokensBefore = evaluations.stream()
                .mapToLong(evaluation -> TokenEstimator.estimate(evaluation.document().content()))
                .sum();
        long tokensAfter = evaluations.stream()
                .mapToLong(evaluation -> TokenEstimator.estimate(evaluation.output()))
                .sum();
        return new BatchSummary(evaluations.size(), failed, qualityPassed, MetricAverages.of(processed),
                avgLatency, tokensBefore, tokensAfter);
    }

    public double failureRate() {
        return total == 0 ? 0.0 : (double) failed / total;
    }

    public double qualityPassRate() {
        return total == 0 ? 0.0 : (double) qualityPassed / total;
    }

    /**
     * Composite quality where failed cases count as zero.
     */
    public double qualityScore() {
        return total == 0 ? 0.0 : average.compositeScore() * (total - failed) / total;
    }

    public boolean meets(QualityThresholds thresholds) {
        return total > 0 && thresholds.accepts(average);
    }
}
