/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Evaluator scores for one before/after pair.
 *
 * @param nrr             noise reduction rate, 0-1
 * @param fprOrIcr        important-content retention, 0-1
 * @param ss              semantic similarity, 0-1
 * @param tokenReduction  token reduction in percent
 * @param parsingErrors   structural errors the evaluator noticed
 */
public record QualityMetrics(
    @JsonProperty("nrr") double nrr,
    @JsonProperty("fpr") double fprOrIcr,
    @JsonProperty("ss") double ss,
    @JsonProperty("token_reduction") double tokenReduction,
    @JsonProperty("parsing_errors") int parsingErrors
) {

    private static final QualityMetrics ZERO = new QualityMetrics(0.0, 0.0, 0.0, 0.0, 0);

    public static QualityMetrics zero() {
        return ZERO;
    }

    /**
     * Mean of NRR, FPR/ICR and SS.
     */
    @JsonIgnore
    public double compositeScore() {
        return (nrr + fprOrIcr + ss) / 3.0;
    }
}
