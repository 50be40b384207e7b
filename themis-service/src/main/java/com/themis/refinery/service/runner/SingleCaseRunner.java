/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.themis.refinery.api.CorpusSource;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleSetVersion;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.gates.regression.RegressionCase;
import com.themis.refinery.service.processing.CaseEvaluation;
import com.themis.refinery.service.processing.CaseProcessor;
import com.themis.refinery.service.processing.TokenEstimator;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Interactive shakedown: one document at a time, counting consecutive
 * quality passes until the rule set is ready for batch scale.
 *
 * <p>Evaluations are cached per (case, rules version); a failed evaluation
 * is never cached so a transient evaluator problem can be retried.
 */
public final class SingleCaseRunner {
    private static final Logger logger = Logger.getLogger(SingleCaseRunner.class.getName());

    private final CorpusSource corpus;
    private final CaseProcessor processor;
    private final RuleStore ruleStore;
    private final EvolutionCycle cycle;
    private final RegressionRecorder regressionRecorder;
    private final int readinessPasses;
    private final Cache<CacheKey, CaseEvaluation> cache;
    private final AtomicInteger consecutivePasses = new AtomicInteger();

    public SingleCaseRunner(CorpusSource corpus, CaseProcessor processor, RuleStore ruleStore,
                            EvolutionCycle cycle, RegressionRecorder regressionRecorder, int readinessPasses) {
        this.corpus = corpus;
        this.processor = processor;
        this.ruleStore = ruleStore;
        this.cycle = cycle;
        this.regressionRecorder = regressionRecorder;
        this.readinessPasses = readinessPasses;
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .build();
    }

    /**
     * @throws IllegalArgumentException when the case does not exist
     * @throws PersistenceException     when a promotion could not be saved
     */
    public SingleCaseReport run(String caseId) throws PersistenceException {
        DocumentCase document = corpus.findCase(caseId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown case: " + caseId));
        RuleSetVersion pinned = ruleStore.current();
        CacheKey key = new CacheKey(caseId, pinned.version());

        CaseEvaluation evaluation = cache.getIfPresent(key);
        boolean fromCache = evaluation != null;
        if (evaluation == null) {
            evaluation = processor.process(document, pinned.rules());
            if (!evaluation.isFailed()) {
                cache.put(key, evaluation);
            }
        }

        boolean passed = !evaluation.isFailed() && evaluation.meetsQuality();
        CycleResult cycleResult = null;
        if (passed) {
            consecutivePasses.incrementAndGet();
        } else {
            consecutivePasses.set(0);
            List<RegressionCase> candidates = regressionRecorder.candidatesFor(evaluation);
            cycleResult = cycle.run(evaluation.suggestions(), "single:" + caseId);
            if (cycleResult.promoted()) {
                List<Rule> live = ruleStore.rules();
                regressionRecorder.recordFixed(candidates,
                        input -> processor.engine().applyRules(input, live).text());
            }
        }

        int passes = consecutivePasses.get();
        long tokensBefore = TokenEstimator.estimate(document.content());
        long tokensAfter = TokenEstimator.estimate(evaluation.output());
        logger.info(String.format("Case %s on %s: %s (%d consecutive passes)",
                caseId, pinned.version(), passed ? "passed" : "failed", passes));
        return new SingleCaseReport(caseId, pinned.version(), passed, fromCache, evaluation.metrics(),
                evaluation.errors(), evaluation.failure(), evaluation.failureKind(),
                diffSummary(document.content(), evaluation.output()),
                tokensBefore, tokensAfter, reductionPercent(tokensBefore, tokensAfter),
                passes, passes >= readinessPasses, cycleResult);
    }

    public int consecutivePasses() {
        return consecutivePasses.get();
    }

    public boolean isReadyForBatch() {
        return consecutivePasses.get() >= readinessPasses;
    }

    public void resetReadiness() {
        consecutivePasses.set(0);
    }

    /**
     * {@code Lines: a → b (+d), Characters: a → b (+d)}.
     */
    static String diffSummary(String before, String after) {
        long linesBefore = before.lines().count();
        long linesAfter = after.lines().count();
        return String.format("Lines: %d → %d (%+d), Characters: %d → %d (%+d)",
                linesBefore, linesAfter, linesAfter - linesBefore,
                before.length(), after.length(), after.length() - before.length());
    }

    static double reductionPercent(long before, long after) {
        if (before == 0) {
            return 0.0;
        }
        return Math.round((before - after) * 10_000.0 / before) / 100.0;
    }

    private record CacheKey(String caseId, String rulesVersion) {
    }
}
