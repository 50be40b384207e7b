/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.themis.refinery.api.model.JobStatus;
import com.themis.refinery.api.model.ProcessingScale;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a job, safe to hand to other threads.
 */
public record JobSnapshot(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("scale") ProcessingScale scale,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("progress_pct") double progressPct,
    @JsonProperty("total_cases") long totalCases,
    @JsonProperty("processed_cases") long processedCases,
    @JsonProperty("failed_cases") long failedCases,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("current_batch") int currentBatch,
    @JsonProperty("total_batches") int totalBatches,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("estimated_completion") Instant estimatedCompletion,
    @JsonProperty("recent_errors") List<CaseError> recentErrors,
    @JsonProperty("result") Map<String, Object> result
) {
}
