/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.job;

import com.themis.refinery.api.model.ErrorKind;
import com.themis.refinery.api.model.JobStatus;
import com.themis.refinery.api.model.ProcessingScale;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Mutable state of one processing job. Progress is written by the job
 * thread only; stop and pause requests may come from any thread and are
 * honoured at the next batch boundary.
 */
public final class ProcessingJob {
    private static final Logger logger = Logger.getLogger(ProcessingJob.class.getName());

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = Map.of(
            JobStatus.PENDING, EnumSet.of(JobStatus.SAMPLING, JobStatus.CANCELLED, JobStatus.FAILED),
            JobStatus.SAMPLING, EnumSet.of(JobStatus.PROCESSING, JobStatus.CANCELLED, JobStatus.FAILED),
            JobStatus.PROCESSING, EnumSet.of(JobStatus.ANALYZING, JobStatus.PAUSED, JobStatus.CANCELLED,
                    JobStatus.FAILED),
            JobStatus.ANALYZING, EnumSet.of(JobStatus.COMPLETED, JobStatus.CANCELLED, JobStatus.FAILED),
            JobStatus.PAUSED, EnumSet.of(JobStatus.PROCESSING, JobStatus.CANCELLED, JobStatus.FAILED),
            JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class),
            JobStatus.FAILED, EnumSet.noneOf(JobStatus.class),
            JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));

    private final String jobId;
    private final ProcessingScale scale;
    private final JobOptions options;
    private final Clock clock;
    private final int recentErrorLimit;
    private final Instant startTime;

    private JobStatus status = JobStatus.PENDING;
    private long totalCases;
    private long processedCases;
    private long failedCases;
    private int currentBatch;
    private int totalBatches;
    private Instant endTime;
    private boolean stopRequested;
    private boolean pauseRequested;
    private final Deque<CaseError> recentErrors = new ArrayDeque<>();
    private final Map<String, Object> result = new LinkedHashMap<>();

    public ProcessingJob(String jobId, ProcessingScale scale, JobOptions options, Clock clock, int recentErrorLimit) {
        this.jobId = jobId;
        this.scale = scale;
        this.options = options;
        this.clock = clock;
        this.recentErrorLimit = recentErrorLimit;
        this.startTime = clock.instant();
    }

    public String jobId() {
        return jobId;
    }

    public ProcessingScale scale() {
        return scale;
    }

    public JobOptions options() {
        return options;
    }

    public synchronized JobStatus status() {
        return status;
    }

    /**
     * @throws IllegalStateException when the state machine does not allow the move
     */
    public synchronized void transition(JobStatus next) {
        if (!TRANSITIONS.get(status).contains(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + status + " to " + next);
        }
        logger.fine(String.format("Job %s: %s -> %s", jobId, status, next));
        status = next;
        if (next.isTerminal()) {
            endTime = clock.instant();
        }
    }

    /**
     * Requests cancellation. A job that is not running is cancelled at once;
     * a running job stops at its next batch boundary.
     *
     * @return false when the job had already finished
     */
    public synchronized boolean requestStop() {
        if (status.isTerminal()) {
            return false;
        }
        stopRequested = true;
        if (status == JobStatus.PENDING || status == JobStatus.PAUSED) {
            transition(JobStatus.CANCELLED);
        }
        return true;
    }

    public synchronized boolean requestPause() {
        if (status.isTerminal() || status == JobStatus.PAUSED) {
            return false;
        }
        pauseRequested = true;
        return true;
    }

    public synchronized void clearPause() {
        pauseRequested = false;
    }

    public synchronized boolean isStopRequested() {
        return stopRequested;
    }

    public synchronized boolean isPauseRequested() {
        return pauseRequested;
    }

    public synchronized void plan(long totalCases, int totalBatches) {
        this.totalCases = totalCases;
        this.totalBatches = totalBatches;
    }

    public synchronized void recordBatch(int batchNumber, long processed, long failed) {
        this.currentBatch = batchNumber;
        this.processedCases += processed;
        this.failedCases += failed;
    }

    /**
     * Restores counters from a checkpoint before resuming.
     */
    public synchronized void restoreProgress(int completedBatches, long processed, long failed) {
        this.currentBatch = completedBatches;
        this.processedCases = processed;
        this.failedCases = failed;
    }

    public synchronized void recordError(String caseId, ErrorKind kind, String message) {
        recentErrors.addLast(new CaseError(caseId, kind, message, clock.instant()));
        while (recentErrors.size() > recentErrorLimit) {
            recentErrors.pollFirst();
        }
    }

    public synchronized void putResult(String key, Object value) {
        result.put(key, value);
    }

    public synchronized void fail(ErrorKind kind, String message) {
        recordError(null, kind, message);
        fail(message);
    }

    /**
     * Fails the job for a reason that is not an error, such as an unmet precondition.
     */
    public synchronized void fail(String message) {
        putResult("failure", message);
        if (!status.isTerminal()) {
            transition(JobStatus.FAILED);
        }
    }

    public synchronized JobSnapshot snapshot() {
        double progress = totalCases == 0 ? 0.0 : Math.min(100.0, processedCases * 100.0 / totalCases);
        double successRate = processedCases == 0 ? 0.0 : (double) (processedCases - failedCases) / processedCases;
        return new JobSnapshot(jobId, scale, status, progress, totalCases, processedCases, failedCases,
                successRate, currentBatch, totalBatches, startTime, endTime, estimateCompletion(),
                List.copyOf(recentErrors), Map.copyOf(result));
    }

    private Instant estimateCompletion() {
        if (status.isTerminal()) {
            return endTime;
        }
        if (processedCases == 0 || totalCases == 0) {
            return null;
        }
        Duration elapsed = Duration.between(startTime, clock.instant());
        long remaining = Math.max(0, totalCases - processedCases);
        return clock.instant().plus(elapsed.multipliedBy(remaining).dividedBy(processedCases));
    }
}
