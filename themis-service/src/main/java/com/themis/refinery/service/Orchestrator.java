/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service;

import com.themis.refinery.api.RulePersistence;
import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.api.model.ErrorKind;
import com.themis.refinery.api.model.JobStatus;
import com.themis.refinery.api.model.ProcessingScale;
import com.themis.refinery.api.model.StratificationCriteria;
import com.themis.refinery.service.checkpoint.CheckpointStore;
import com.themis.refinery.service.config.RefinerySettings;
import com.themis.refinery.service.job.JobOptions;
import com.themis.refinery.service.job.JobRegistry;
import com.themis.refinery.service.job.JobSnapshot;
import com.themis.refinery.service.job.ProcessingJob;
import com.themis.refinery.service.runner.BatchCycleReport;
import com.themis.refinery.service.runner.EvolutionCycle;
import com.themis.refinery.service.runner.FullCorpusRunner;
import com.themis.refinery.service.runner.FullRunReport;
import com.themis.refinery.service.runner.PatchRollbackResult;
import com.themis.refinery.service.runner.SingleCaseReport;
import com.themis.refinery.service.runner.SingleCaseRunner;
import com.themis.refinery.service.runner.StratifiedBatchRunner;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs processing jobs at single, batch and full-corpus scale.
 *
 * <p>Every job, and every rule mutation it triggers, runs on one job
 * thread, so the live rule set has a single writer. Control calls only
 * flip flags on the job and may come from any thread.
 */
public final class Orchestrator implements JobControl, AutoCloseable {
    private static final Logger logger = Logger.getLogger(Orchestrator.class.getName());

    private final SingleCaseRunner singleCaseRunner;
    private final StratifiedBatchRunner batchRunner;
    private final FullCorpusRunner fullCorpusRunner;
    private final EvolutionCycle evolutionCycle;
    private final RulePersistence persistence;
    private final CheckpointStore checkpoints;
    private final RefinerySettings settings;
    private final Telemetry telemetry;
    private final Clock clock;
    private final JobRegistry registry = new JobRegistry();
    private final ExecutorService jobThread;

    public Orchestrator(SingleCaseRunner singleCaseRunner, StratifiedBatchRunner batchRunner,
                        FullCorpusRunner fullCorpusRunner, EvolutionCycle evolutionCycle,
                        RulePersistence persistence, CheckpointStore checkpoints, RefinerySettings settings,
                        Telemetry telemetry, Clock clock) {
        this.singleCaseRunner = singleCaseRunner;
        this.batchRunner = batchRunner;
        this.fullCorpusRunner = fullCorpusRunner;
        this.evolutionCycle = evolutionCycle;
        this.persistence = persistence;
        this.checkpoints = checkpoints;
        this.settings = settings;
        this.telemetry = telemetry;
        this.clock = clock;
        this.jobThread = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "themis-jobs");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String start(ProcessingScale scale, JobOptions options) {
        JobOptions effective = options == null ? JobOptions.defaults() : options;
        if (scale == ProcessingScale.SINGLE && (effective.caseId() == null || effective.caseId().isBlank())) {
            throw new IllegalArgumentException("A single-case job needs a case id");
        }
        if (effective.sampleSize() != null && effective.sampleSize() <= 0) {
            throw new IllegalArgumentException("Sample size must be positive");
        }
        ProcessingJob job = new ProcessingJob(registry.nextId(scale), scale, effective, clock,
                settings.recentErrorLimit());
        registry.register(job);
        jobThread.submit(() -> execute(job, false));
        logger.info(String.format("Queued %s job %s", scale.name().toLowerCase(Locale.ROOT), job.jobId()));
        return job.jobId();
    }

    @Override
    public boolean stop(String jobId) {
        Optional<ProcessingJob> job = registry.find(jobId);
        if (job.isEmpty()) {
            return false;
        }
        boolean wasPaused = job.get().status() == JobStatus.PAUSED;
        boolean accepted = job.get().requestStop();
        if (accepted && wasPaused) {
            discardCheckpoint(jobId);
        }
        return accepted;
    }

    @Override
    public boolean pause(String jobId) {
        return registry.find(jobId)
                .filter(job -> job.scale() == ProcessingScale.FULL)
                .map(ProcessingJob::requestPause)
                .orElse(false);
    }

    @Override
    public boolean resume(String jobId) {
        Optional<ProcessingJob> job = registry.find(jobId);
        if (job.isEmpty() || job.get().status() != JobStatus.PAUSED) {
            return false;
        }
        job.get().clearPause();
        jobThread.submit(() -> execute(job.get(), true));
        logger.info("Resuming job " + jobId);
        return true;
    }

    @Override
    public Optional<JobSnapshot> status(String jobId) {
        return registry.find(jobId).map(ProcessingJob::snapshot);
    }

    @Override
    public List<JobSnapshot> jobs() {
        return registry.all().stream().map(ProcessingJob::snapshot).toList();
    }

    /**
     * Re-activates the previous stable rule set, on the job thread.
     *
     * @return the version now active, empty when there was nothing to roll back to
     */
    public Optional<String> rollbackToPrevious() throws PersistenceException, InterruptedException {
        return onJobThread(() -> evolutionCycle.rollbackToPrevious(persistence));
    }

    /**
     * Undoes one applied patch, on the job thread, and promotes the result
     * as a new patch version.
     */
    public PatchRollbackResult rollbackPatch(String patchId) throws PersistenceException, InterruptedException {
        return onJobThread(() -> evolutionCycle.rollbackPatch(patchId));
    }

    private <T> T onJobThread(Callable<T> action) throws PersistenceException, InterruptedException {
        Future<T> pending = jobThread.submit(action);
        try {
            return pending.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof PersistenceException persistenceFailure) {
                throw persistenceFailure;
            }
            throw new IllegalStateException("Rollback failed", e.getCause());
        }
    }

    @Override
    public void close() {
        jobThread.shutdownNow();
        try {
            if (!jobThread.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warning("Job thread did not stop within 30 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void execute(ProcessingJob job, boolean resume) {
        if (job.status().isTerminal()) {
            return;
        }
        try {
            switch (job.scale()) {
                case SINGLE -> runSingle(job);
                case BATCH -> runBatch(job);
                case FULL -> runFull(job, resume);
            }
        } catch (CancellationException e) {
            cancel(job);
        } catch (PersistenceException e) {
            logger.log(Level.SEVERE, "Job " + job.jobId() + " halted: rule state could not be saved", e);
            telemetry.recordAlert("persistence_failure", AlertSeverity.CRITICAL, e.getMessage());
            job.fail(ErrorKind.PERSISTENCE, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.fail(ErrorKind.CASE_PROCESSING, "interrupted");
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Job " + job.jobId() + " failed", e);
            job.fail(ErrorKind.CASE_PROCESSING, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        logger.info(String.format("Job %s finished as %s", job.jobId(), job.status()));
    }

    private void runSingle(ProcessingJob job) throws PersistenceException {
        job.transition(JobStatus.SAMPLING);
        job.plan(1, 1);
        job.transition(JobStatus.PROCESSING);
        SingleCaseReport report = singleCaseRunner.run(job.options().caseId());
        boolean failed = report.failure() != null;
        if (failed) {
            job.recordError(report.caseId(), report.failureKind(), report.failure());
        }
        job.recordBatch(1, 1, failed ? 1 : 0);
        job.transition(JobStatus.ANALYZING);
        job.putResult("report", report);
        if (report.cycle() != null) {
            job.putResult("cycle_outcome", report.cycle().outcome().name().toLowerCase(Locale.ROOT));
            job.putResult("active_version", report.cycle().activeVersion());
        }
        job.transition(JobStatus.COMPLETED);
    }

    private void runBatch(ProcessingJob job) throws PersistenceException, InterruptedException {
        JobOptions options = job.options();
        int sampleSize = options.sampleSize() != null ? options.sampleSize() : settings.batchSampleSize();
        StratificationCriteria criteria = options.criteria() != null
                ? options.criteria()
                : StratificationCriteria.defaults();
        BatchCycleReport report = batchRunner.run(job, sampleSize, criteria);
        report.toResult().forEach(job::putResult);
        job.transition(JobStatus.COMPLETED);
    }

    private void runFull(ProcessingJob job, boolean resume) throws PersistenceException, InterruptedException {
        FullRunReport report = fullCorpusRunner.run(job, resume);
        report.toResult().forEach(job::putResult);
        switch (report.outcome()) {
            case COMPLETED -> job.transition(JobStatus.COMPLETED);
            case PAUSED -> logger.info("Job " + job.jobId() + " paused");
            case CANCELLED -> cancel(job);
            case NOT_READY -> job.fail("full corpus not ready: " + String.join("; ", report.readinessReasons()));
            case DRY_RUN_FAILED -> job.fail("dry run failed: " + String.join("; ", report.dryRun().reasons()));
        }
    }

    private void cancel(ProcessingJob job) {
        if (!job.status().isTerminal()) {
            job.transition(JobStatus.CANCELLED);
        }
        logger.info("Job " + job.jobId() + " cancelled");
    }

    private void discardCheckpoint(String jobId) {
        try {
            checkpoints.delete(jobId);
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Could not delete checkpoint of cancelled job " + jobId, e);
        }
    }
}
