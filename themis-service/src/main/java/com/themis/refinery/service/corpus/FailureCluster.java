/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.corpus;

import java.util.List;

/**
 * Failures of one pattern class within a batch.
 *
 * @param failureCount number of reported errors in this class
 * @param caseIds      distinct cases contributing to the cluster, in encounter order
 */
public record FailureCluster(FailurePattern pattern, int failureCount, List<String> caseIds,
                             List<String> sampleErrors) {

    public FailureCluster {
        caseIds = List.copyOf(caseIds);
        sampleErrors = List.copyOf(sampleErrors);
    }
}
