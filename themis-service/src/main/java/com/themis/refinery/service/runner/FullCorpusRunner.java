/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.themis.refinery.api.CorpusSource;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.JobStatus;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleSetVersion;
import com.themis.refinery.api.model.StratificationCriteria;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.service.checkpoint.Checkpoint;
import com.themis.refinery.service.checkpoint.CheckpointStore;
import com.themis.refinery.service.config.RefinerySettings;
import com.themis.refinery.service.job.ProcessingJob;
import com.themis.refinery.service.processing.BatchSummary;
import com.themis.refinery.service.processing.BoundedBatchExecutor;
import com.themis.refinery.service.processing.CaseEvaluation;
import com.themis.refinery.service.processing.CaseProcessor;
import com.themis.refinery.service.processing.ProcessedCaseSink;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Processes the whole corpus in offset batches once readiness and a dry run
 * allow it.
 *
 * <p>Each batch uses the rules pinned at its start; rule usage is absorbed
 * and a checkpoint saved after it completes. Stop and pause requests take
 * effect at batch boundaries only. A resumed run continues at the
 * checkpoint offset and skips readiness and the dry run.
 */
public final class FullCorpusRunner {
    private static final Logger logger = Logger.getLogger(FullCorpusRunner.class.getName());

    private static final StratificationCriteria ANY_STRATUM = new StratificationCriteria(null, null, null, null);

    private final CorpusSource corpus;
    private final CaseProcessor processor;
    private final RuleStore ruleStore;
    private final CheckpointStore checkpoints;
    private final ProcessedCaseSink sink;
    private final ReadinessCheck readinessCheck;
    private final DryRunCriteria dryRunCriteria;
    private final CostModel costModel;
    private final BoundedBatchExecutor executor;
    private final RefinerySettings settings;
    private final Tracer tracer;
    private final Clock clock;

    public FullCorpusRunner(CorpusSource corpus, CaseProcessor processor, RuleStore ruleStore,
                            CheckpointStore checkpoints, ProcessedCaseSink sink, ReadinessCheck readinessCheck,
                            DryRunCriteria dryRunCriteria, CostModel costModel, BoundedBatchExecutor executor,
                            RefinerySettings settings, Tracer tracer, Clock clock) {
        this.corpus = corpus;
        this.processor = processor;
        this.ruleStore = ruleStore;
        this.checkpoints = checkpoints;
        this.sink = sink;
        this.readinessCheck = readinessCheck;
        this.dryRunCriteria = dryRunCriteria;
        this.costModel = costModel;
        this.executor = executor;
        this.settings = settings;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Runs until the corpus is done or a stop or pause request is seen. The job
     * is left in {@code ANALYZING} when completed, {@code PAUSED} when paused,
     * and unchanged otherwise; the caller finishes it from the report.
     */
    public FullRunReport run(ProcessingJob job, boolean resume) throws PersistenceException, InterruptedException {
        long offset = 0;
        int completedBatches = 0;
        long processed = 0;
        long failed = 0;
        DryRunVerdict dryRun = null;

        if (resume) {
            Checkpoint checkpoint = checkpoints.load(job.jobId())
                    .orElseThrow(() -> new IllegalStateException("No checkpoint for job " + job.jobId()));
            offset = checkpoint.nextOffset();
            completedBatches = checkpoint.completedBatches();
            processed = checkpoint.processed();
            failed = checkpoint.failed();
            job.restoreProgress(completedBatches, processed, failed);
            logger.info(String.format("Job %s: resuming at offset %d after %d batches",
                    job.jobId(), offset, completedBatches));
        } else {
            job.transition(JobStatus.SAMPLING);
            ReadinessVerdict readiness = readinessCheck.evaluate();
            if (!readiness.ready()) {
                logger.warning(String.format("Job %s: full corpus not ready: %s",
                        job.jobId(), String.join("; ", readiness.reasons())));
                return FullRunReport.notReady(readiness.reasons());
            }
            dryRun = dryRun(job);
            if (!dryRun.ready()) {
                logger.warning(String.format("Job %s: dry run failed: %s",
                        job.jobId(), String.join("; ", dryRun.reasons())));
                return FullRunReport.dryRunFailed(dryRun);
            }
        }

        long total = corpus.count();
        int batchSize = settings.fullBatchSize();
        job.plan(total, (int) ((total + batchSize - 1) / batchSize));
        job.transition(JobStatus.PROCESSING);

        while (offset < total) {
            if (job.isStopRequested()) {
                checkpoints.delete(job.jobId());
                return report(FullRunReport.Outcome.CANCELLED, dryRun, processed, failed, completedBatches, offset);
            }
            if (job.isPauseRequested()) {
                checkpoints.save(new Checkpoint(job.jobId(), offset, completedBatches, processed, failed,
                        ruleStore.version(), clock.instant()));
                job.clearPause();
                job.transition(JobStatus.PAUSED);
                logger.info(String.format("Job %s: paused at offset %d", job.jobId(), offset));
                return report(FullRunReport.Outcome.PAUSED, dryRun, processed, failed, completedBatches, offset);
            }

            List<DocumentCase> page = corpus.page(offset, batchSize);
            if (page.isEmpty()) {
                break;
            }
            List<CaseEvaluation> results = processBatch(job, page, completedBatches + 1);
            long batchFailed = results.stream().filter(CaseEvaluation::isFailed).count();
            results.forEach(sink::accept);
            ruleStore.absorbUsage(processor.engine().usageCounter().drain());

            offset += page.size();
            completedBatches++;
            processed += results.size();
            failed += batchFailed;
            checkpoints.save(new Checkpoint(job.jobId(), offset, completedBatches, processed, failed,
                    ruleStore.version(), clock.instant()));
        }

        job.transition(JobStatus.ANALYZING);
        checkpoints.delete(job.jobId());
        logger.info(String.format("Job %s: full corpus done, %d processed, %d failed in %d batches",
                job.jobId(), processed, failed, completedBatches));
        return report(FullRunReport.Outcome.COMPLETED, dryRun, processed, failed, completedBatches, offset);
    }

    /**
     * Processes a fraction of the corpus and judges it against the dry-run criteria.
     */
    DryRunVerdict dryRun(ProcessingJob job) throws InterruptedException {
        long corpusSize = corpus.count();
        int planned = (int) Math.max(1, Math.ceil(corpusSize * settings.dryRunFraction()));
        List<DocumentCase> sample = corpus.stratifiedSample(ANY_STRATUM, planned);
        double availability = (double) sample.size() / planned;
        if (availability < settings.dryRunMinAvailability()) {
            DryRunStats empty = new DryRunStats(sample.size(), 0.0, Duration.ZERO, 0.0);
            return new DryRunVerdict(false, empty, List.of(String.format(
                    "dry run sample unavailable: %d of %d documents", sample.size(), planned)));
        }

        List<Rule> pinned = ruleStore.rules();
        List<CaseEvaluation> results = new ArrayList<>(sample.size());
        for (int from = 0; from < sample.size(); from += settings.dryRunBatchSize()) {
            List<DocumentCase> chunk = sample.subList(from, Math.min(sample.size(), from + settings.dryRunBatchSize()));
            results.addAll(executor.processAll(chunk, document -> processor.process(document, pinned)));
        }
        processor.engine().usageCounter().drain();

        BatchSummary summary = BatchSummary.of(results);
        DryRunStats stats = new DryRunStats(sample.size(), summary.failureRate(),
                Duration.ofMillis(Math.round(summary.avgLatencyMs())),
                costModel.extrapolate(summary.tokensBefore(), summary.total(), corpusSize));
        DryRunVerdict verdict = dryRunCriteria.evaluate(stats);
        logger.info(String.format("Job %s: dry run on %d documents: failure rate %.3f, latency %d ms, cost $%.2f",
                job.jobId(), stats.sampleSize(), stats.failureRate(), stats.avgLatency().toMillis(),
                stats.estimatedCost()));
        return verdict;
    }

    private List<CaseEvaluation> processBatch(ProcessingJob job, List<DocumentCase> page, int batchNumber)
            throws InterruptedException {
        RuleSetVersion pinned = ruleStore.current();
        Span span = tracer.spanBuilder("full-corpus-batch")
                .setAttribute("job_id", job.jobId())
                .setAttribute("batch", batchNumber)
                .setAttribute("rules_version", pinned.version())
                .startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<CaseEvaluation> results = executor.processAll(page,
                    document -> processor.process(document, pinned.rules()));
            long failed = 0;
            for (CaseEvaluation result : results) {
                if (result.isFailed()) {
                    failed++;
                    job.recordError(result.caseId(), result.failureKind(), result.failure());
                }
            }
            job.recordBatch(batchNumber, results.size(), failed);
            span.setAttribute("failed", failed);
            return results;
        } finally {
            span.end();
        }
    }

    private static FullRunReport report(FullRunReport.Outcome outcome, DryRunVerdict dryRun, long processed,
                                        long failed, int completedBatches, long offset) {
        return new FullRunReport(outcome, List.of(), dryRun, processed, failed, completedBatches, offset);
    }
}
