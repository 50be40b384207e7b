/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.job;

import com.themis.refinery.api.model.StratificationCriteria;

/**
 * Per-job parameters; unset values fall back to the configured defaults.
 *
 * @param caseId     document to process (single scale)
 * @param sampleSize sample size (batch scale); {@code null} for the default
 * @param criteria   strata to sample from (batch scale); {@code null} for the default
 */
public record JobOptions(String caseId, Integer sampleSize, StratificationCriteria criteria) {

    public static JobOptions single(String caseId) {
        return new JobOptions(caseId, null, null);
    }

    public static JobOptions batch(int sampleSize, StratificationCriteria criteria) {
        return new JobOptions(null, sampleSize, criteria);
    }

    public static JobOptions defaults() {
        return new JobOptions(null, null, null);
    }
}
