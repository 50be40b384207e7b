/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.themis.refinery.api.CorpusSource;
import com.themis.refinery.api.RulePersistence;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.JobStatus;
import com.themis.refinery.api.model.RawSuggestion;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.StratificationCriteria;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.evolution.AutoRollbackPolicy;
import com.themis.refinery.evolution.AutoRollbackPolicy.RollbackDecision;
import com.themis.refinery.evolution.AutoRollbackPolicy.VersionPerformance;
import com.themis.refinery.gates.regression.RegressionCase;
import com.themis.refinery.service.corpus.FailureCluster;
import com.themis.refinery.service.corpus.FailureClusterer;
import com.themis.refinery.service.job.ProcessingJob;
import com.themis.refinery.service.processing.BatchSummary;
import com.themis.refinery.service.processing.BoundedBatchExecutor;
import com.themis.refinery.service.processing.CaseEvaluation;
import com.themis.refinery.service.processing.CaseProcessor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/**
 * Processes a stratified sample, clusters what went wrong, runs an
 * evolution cycle and re-validates the same sample under the new rules.
 *
 * <p>Keeps two things across cycles: the number of consecutive cycles
 * without a significant gain and the latest summary. The suggested next
 * sample size is only reported in the {@link BatchCycleReport}; callers
 * pass the size they want each time. Driven from the job thread only.
 */
public final class StratifiedBatchRunner {
    private static final Logger logger = Logger.getLogger(StratifiedBatchRunner.class.getName());

    static final double SIGNIFICANT_QUALITY_GAIN = 0.03;
    static final double SIGNIFICANT_FAILURE_DROP = 0.05;
    static final int TOP_CLUSTERS = 3;
    private static final double DIVERSITY_TARGET = 15.0;

    private final CorpusSource corpus;
    private final CaseProcessor processor;
    private final RuleStore ruleStore;
    private final RulePersistence persistence;
    private final EvolutionCycle cycle;
    private final FailureClusterer clusterer;
    private final RegressionRecorder regressionRecorder;
    private final AutoRollbackPolicy rollbackPolicy;
    private final BoundedBatchExecutor executor;
    private final int sampleCap;
    private final int stabilizationCycles;

    private int nonSignificantCycles;
    private volatile BatchSummary latestSummary;

    public StratifiedBatchRunner(CorpusSource corpus, CaseProcessor processor, RuleStore ruleStore,
                                 RulePersistence persistence, EvolutionCycle cycle, FailureClusterer clusterer,
                                 RegressionRecorder regressionRecorder, AutoRollbackPolicy rollbackPolicy,
                                 BoundedBatchExecutor executor, int sampleCap, int stabilizationCycles) {
        this.corpus = corpus;
        this.processor = processor;
        this.ruleStore = ruleStore;
        this.persistence = persistence;
        this.cycle = cycle;
        this.clusterer = clusterer;
        this.regressionRecorder = regressionRecorder;
        this.rollbackPolicy = rollbackPolicy;
        this.executor = executor;
        this.sampleCap = sampleCap;
        this.stabilizationCycles = stabilizationCycles;
    }

    /**
     * Runs one batch cycle and leaves the job in {@code ANALYZING}.
     *
     * @throws CancellationException when a stop was requested between phases
     * @throws PersistenceException  when a promotion or rollback could not be saved
     */
    public BatchCycleReport run(ProcessingJob job, int requestedSize, StratificationCriteria criteria)
            throws PersistenceException, InterruptedException {
        job.transition(JobStatus.SAMPLING);
        int sampleSize = Math.min(requestedSize, sampleCap);
        List<DocumentCase> sample = corpus.stratifiedSample(criteria, sampleSize);
        double diversity = diversityScore(sample);
        logger.info(String.format("Job %s: sampled %d of %d requested documents (diversity %.2f)",
                job.jobId(), sample.size(), sampleSize, diversity));
        job.plan(sample.size(), 1);
        checkStop(job);

        job.transition(JobStatus.PROCESSING);
        List<CaseEvaluation> initial = processBatch(job, sample, 1);
        BatchSummary before = BatchSummary.of(initial);
        latestSummary = before;
        absorbUsage();
        checkStop(job);

        job.transition(JobStatus.ANALYZING);
        List<FailureCluster> clusters = clusterer.cluster(initial);
        CycleResult cycleResult = cycle.run(prioritizedSuggestions(initial, clusters), "batch:" + job.jobId());

        BatchSummary after = before;
        List<String> rollbackReasons = List.of();
        if (cycleResult.promoted()) {
            job.plan(2L * sample.size(), 2);
            List<CaseEvaluation> revalidated = processBatch(job, sample, 2);
            after = BatchSummary.of(revalidated);
            absorbUsage();
            rollbackReasons = checkForRollback(before, after);
            if (rollbackReasons.isEmpty()) {
                recordFixedRegressions(initial, revalidated);
                latestSummary = after;
            }
        }

        NextAction nextAction = decide(before, after, rollbackReasons.isEmpty());
        int nextSize = nextAction == NextAction.SCALE_UP ? Math.min(sampleSize * 2, sampleCap) : sampleSize;
        BatchCycleReport report = new BatchCycleReport(sample.size(), diversity, before, after, clusters,
                cycleResult, rollbackReasons, ruleStore.version(), nextAction, nextSize);
        logger.info(String.format("Job %s: quality %.3f -> %.3f, failure rate %.3f -> %.3f, next action %s",
                job.jobId(), before.qualityScore(), after.qualityScore(), before.failureRate(),
                after.failureRate(), nextAction.code()));
        return report;
    }

    public Optional<BatchSummary> latestSummary() {
        return Optional.ofNullable(latestSummary);
    }

    /**
     * Distinct courts, case types and years over a target of 15, capped at 1.
     */
    static double diversityScore(List<DocumentCase> sample) {
        Set<String> courts = new LinkedHashSet<>();
        Set<String> caseTypes = new LinkedHashSet<>();
        Set<Integer> years = new LinkedHashSet<>();
        for (DocumentCase document : sample) {
            courts.add(document.courtType());
            caseTypes.add(document.caseType());
            years.add(document.year());
        }
        return Math.min(1.0, (courts.size() + caseTypes.size() + years.size()) / DIVERSITY_TARGET);
    }

    /**
     * Suggestions of cases in the largest clusters come first.
     */
    static List<RawSuggestion> prioritizedSuggestions(List<CaseEvaluation> evaluations,
                                                      List<FailureCluster> clusters) {
        Set<String> prioritized = new LinkedHashSet<>();
        clusters.stream().limit(TOP_CLUSTERS).forEach(cluster -> prioritized.addAll(cluster.caseIds()));

        List<RawSuggestion> first = new ArrayList<>();
        List<RawSuggestion> rest = new ArrayList<>();
        for (CaseEvaluation evaluation : evaluations) {
            (prioritized.contains(evaluation.caseId()) ? first : rest).addAll(evaluation.suggestions());
        }
        first.addAll(rest);
        return first;
    }

    NextAction decide(BatchSummary before, BatchSummary after, boolean kept) {
        boolean significant = kept
                && (after.qualityScore() - before.qualityScore() >= SIGNIFICANT_QUALITY_GAIN
                || before.failureRate() - after.failureRate() >= SIGNIFICANT_FAILURE_DROP);
        if (significant) {
            nonSignificantCycles = 0;
            return NextAction.SCALE_UP;
        }
        nonSignificantCycles++;
        return nonSignificantCycles >= stabilizationCycles ? NextAction.STABILIZED : NextAction.RETRY_SAME_SCALE;
    }

    private List<CaseEvaluation> processBatch(ProcessingJob job, List<DocumentCase> documents, int batchNumber)
            throws InterruptedException {
        List<Rule> pinned = ruleStore.rules();
        List<CaseEvaluation> results = executor.processAll(documents, document -> processor.process(document, pinned));
        long failed = 0;
        for (CaseEvaluation result : results) {
            if (result.isFailed()) {
                failed++;
                job.recordError(result.caseId(), result.failureKind(), result.failure());
            }
        }
        job.recordBatch(batchNumber, results.size(), failed);
        return results;
    }

    private List<String> checkForRollback(BatchSummary before, BatchSummary after) throws PersistenceException {
        RollbackDecision decision = rollbackPolicy.evaluate(performanceOf(after), performanceOf(before));
        if (!decision.rollback()) {
            return List.of();
        }
        logger.warning("Re-validation degraded, rolling back: " + String.join("; ", decision.reasons()));
        cycle.rollbackToPrevious(persistence);
        return decision.reasons();
    }

    private void recordFixedRegressions(List<CaseEvaluation> initial, List<CaseEvaluation> revalidated) {
        Map<String, String> outputs = new HashMap<>();
        revalidated.forEach(evaluation -> outputs.put(evaluation.document().content(), evaluation.output()));
        List<RegressionCase> candidates = new ArrayList<>();
        initial.stream().filter(CaseEvaluation::hasProblems)
                .forEach(evaluation -> candidates.addAll(regressionRecorder.candidatesFor(evaluation)));
        regressionRecorder.recordFixed(candidates, input -> outputs.getOrDefault(input, input));
    }

    private void absorbUsage() throws PersistenceException {
        ruleStore.absorbUsage(processor.engine().usageCounter().drain());
    }

    private static VersionPerformance performanceOf(BatchSummary summary) {
        return new VersionPerformance(summary.average().nrr(), summary.average().fprOrIcr(),
                summary.average().ss(), summary.failureRate());
    }

    private static void checkStop(ProcessingJob job) {
        if (job.isStopRequested()) {
            throw new CancellationException("Job " + job.jobId() + " stopped");
        }
    }
}
