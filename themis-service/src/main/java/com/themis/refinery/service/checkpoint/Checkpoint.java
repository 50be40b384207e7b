/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Progress of a full-corpus job after its last completed batch.
 *
 * @param nextOffset corpus offset the next batch starts at
 */
public record Checkpoint(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("next_offset") long nextOffset,
    @JsonProperty("completed_batches") int completedBatches,
    @JsonProperty("processed") long processed,
    @JsonProperty("failed") long failed,
    @JsonProperty("rules_version") String rulesVersion,
    @JsonProperty("updated_at") Instant updatedAt
) {
}
