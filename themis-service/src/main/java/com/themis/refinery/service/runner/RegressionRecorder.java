/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.themis.refinery.gates.regression.RegressionCase;
import com.themis.refinery.gates.regression.RegressionSuite;
import com.themis.refinery.service.corpus.FailurePattern;
import com.themis.refinery.service.processing.CaseEvaluation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Turns failed cases into regression cases. A case enters the suite once
 * a promoted rule set no longer reproduces it, so the suite only guards
 * fixes that have actually been made.
 */
public final class RegressionRecorder {
    private static final Logger logger = Logger.getLogger(RegressionRecorder.class.getName());

    private final RegressionSuite suite;
    private final Clock clock;

    public RegressionRecorder(RegressionSuite suite, Clock clock) {
        this.suite = suite;
        this.clock = clock;
    }

    /**
     * One candidate per recognisable noise pattern in the case's errors.
     */
    public List<RegressionCase> candidatesFor(CaseEvaluation evaluation) {
        List<String> messages = new ArrayList<>(evaluation.errors());
        if (evaluation.failure() != null) {
            messages.add(evaluation.failure());
        }
        Set<FailurePattern> seen = EnumSet.noneOf(FailurePattern.class);
        List<RegressionCase> candidates = new ArrayList<>();
        for (String message : messages) {
            FailurePattern pattern = FailurePattern.classify(message);
            if (pattern.residualPattern().isBlank() || !seen.add(pattern)) {
                continue;
            }
            candidates.add(new RegressionCase(
                    evaluation.caseId() + ":" + pattern.code(),
                    message,
                    evaluation.document().content(),
                    pattern.residualPattern(),
                    List.of(),
                    clock.instant()));
        }
        return candidates;
    }

    /**
     * Records the candidates the current rules no longer reproduce.
     *
     * @param outputFor processed text for a regression input under the live rules
     * @return number of cases recorded
     */
    public int recordFixed(List<RegressionCase> candidates, Function<String, String> outputFor) {
        int recorded = 0;
        for (RegressionCase candidate : candidates) {
            if (!candidate.reproducesIn(outputFor.apply(candidate.input()))) {
                suite.record(candidate);
                recorded++;
            }
        }
        if (recorded > 0) {
            logger.info(String.format("Recorded %d regression cases (suite size %d)", recorded, suite.size()));
        }
        return recorded;
    }

    public RegressionSuite suite() {
        return suite;
    }
}
