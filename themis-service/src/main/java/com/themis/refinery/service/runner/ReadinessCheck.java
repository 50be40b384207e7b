/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.RuleSetVersion;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.gates.QualityThresholds;
import com.themis.refinery.gates.regression.RegressionGate;
import com.themis.refinery.service.processing.BatchSummary;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Preconditions for a full-corpus run: the latest stratified batch met the
 * quality thresholds, the live rules reproduce no recorded regression and
 * nothing was promoted within the stability window.
 */
public final class ReadinessCheck {

    private final Supplier<Optional<BatchSummary>> latestBatch;
    private final QualityThresholds thresholds;
    private final RegressionGate regressionGate;
    private final RuleStore ruleStore;
    private final Duration stabilityWindow;
    private final Clock clock;

    public ReadinessCheck(Supplier<Optional<BatchSummary>> latestBatch, QualityThresholds thresholds,
                          RegressionGate regressionGate, RuleStore ruleStore, Duration stabilityWindow,
                          Clock clock) {
        this.latestBatch = latestBatch;
        this.thresholds = thresholds;
        this.regressionGate = regressionGate;
        this.ruleStore = ruleStore;
        this.stabilityWindow = stabilityWindow;
        this.clock = clock;
    }

    public ReadinessVerdict evaluate() {
        List<String> reasons = new ArrayList<>();

        Optional<BatchSummary> batch = latestBatch.get();
        if (batch.isEmpty()) {
            reasons.add("no stratified batch has been run");
        } else if (!batch.get().meets(thresholds)) {
            reasons.add("latest batch below quality thresholds: "
                    + String.join(", ", thresholds.violations(batch.get().average())));
        }

        GateResult regression = regressionGate.evaluate(ruleStore.rules());
        if (!regression.passed()) {
            reasons.add("live rules reproduce recorded regressions: " + regression.details().get("reproduced"));
        }

        RuleSetVersion live = ruleStore.current();
        if (live.parentVersion() != null
                && live.createdAt().plus(stabilityWindow).isAfter(clock.instant())) {
            reasons.add(String.format("rule set %s promoted less than %d minutes ago",
                    live.version(), stabilityWindow.toMinutes()));
        }
        return new ReadinessVerdict(reasons.isEmpty(), reasons);
    }
}
