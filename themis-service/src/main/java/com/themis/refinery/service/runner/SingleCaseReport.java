/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.themis.refinery.api.model.ErrorKind;
import com.themis.refinery.api.model.QualityMetrics;

import java.util.List;

/**
 * Outcome of processing one document at single-case scale.
 *
 * @param cycle evolution cycle run after a failed quality check, or {@code null}
 */
public record SingleCaseReport(
    @JsonProperty("case_id") String caseId,
    @JsonProperty("rules_version") String rulesVersion,
    @JsonProperty("passed") boolean passed,
    @JsonProperty("from_cache") boolean fromCache,
    @JsonProperty("metrics") QualityMetrics metrics,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("failure") String failure,
    @JsonProperty("failure_kind") ErrorKind failureKind,
    @JsonProperty("diff_summary") String diffSummary,
    @JsonProperty("tokens_before") long tokensBefore,
    @JsonProperty("tokens_after") long tokensAfter,
    @JsonProperty("token_reduction_pct") double tokenReductionPct,
    @JsonProperty("consecutive_passes") int consecutivePasses,
    @JsonProperty("ready_for_batch") boolean readyForBatch,
    @JsonIgnore CycleResult cycle
) {
}
