/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.themis.refinery.api.model.ErrorKind;

import java.time.Instant;

/**
 * @param caseId document the error belongs to; {@code null} for job-level errors
 */
public record CaseError(
    @JsonProperty("case_id") String caseId,
    @JsonProperty("kind") ErrorKind kind,
    @JsonProperty("message") String message,
    @JsonProperty("at") Instant at
) {
}
