/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.themis.refinery.service.corpus.FailureCluster;
import com.themis.refinery.service.processing.BatchSummary;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * @param before          summary of the sample under the rules pinned at batch start
 * @param after           summary after re-validation; equal to {@code before} when nothing was promoted
 * @param rollbackReasons why a promoted version was rolled back; empty when it was kept
 * @param activeVersion   live version once the cycle, and any rollback, finished
 */
public record BatchCycleReport(
    int sampleSize,
    double diversityScore,
    BatchSummary before,
    BatchSummary after,
    List<FailureCluster> clusters,
    CycleResult cycle,
    List<String> rollbackReasons,
    String activeVersion,
    NextAction nextAction,
    int nextSampleSize
) {

    public BatchCycleReport {
        clusters = List.copyOf(clusters);
        rollbackReasons = List.copyOf(rollbackReasons);
    }

    public double qualityGain() {
        return after.qualityScore() - before.qualityScore();
    }

    public double failureRateDrop() {
        return before.failureRate() - after.failureRate();
    }

    public boolean rolledBack() {
        return !rollbackReasons.isEmpty();
    }

    /**
     * Flat view stored in the job result.
     */
    public Map<String, Object> toResult() {
        return Map.of(
                "sample_size", sampleSize,
                "diversity_score", diversityScore,
                "before", before,
                "after", after,
                "clusters", clusters.stream().map(c -> c.pattern().code() + "=" + c.failureCount()).toList(),
                "cycle_outcome", cycle.outcome().name().toLowerCase(Locale.ROOT),
                "active_version", activeVersion,
                "rollback_reasons", rollbackReasons,
                "next_action", nextAction.code(),
                "next_sample_size", nextSampleSize);
    }
}
