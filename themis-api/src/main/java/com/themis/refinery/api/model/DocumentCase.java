/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One court decision from the corpus.
 */
public record DocumentCase(
    @JsonProperty("case_id") String caseId,
    @JsonProperty("court_type") String courtType,
    @JsonProperty("case_type") String caseType,
    @JsonProperty("year") int year,
    @JsonProperty("format_type") String formatType,
    @JsonProperty("content") String content
) {

    public DocumentCase {
        Objects.requireNonNull(caseId, "caseId");
        if (content == null) content = "";
        if (courtType == null) courtType = "";
        if (caseType == null) caseType = "";
        if (formatType == null) formatType = "";
    }
}
