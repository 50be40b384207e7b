/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.processing;

/**
 * Destination for documents processed during a full-corpus run.
 */
@FunctionalInterface
public interface ProcessedCaseSink {

    void accept(CaseEvaluation evaluation);

    static ProcessedCaseSink discard() {
        return evaluation -> {
            // dropped
        };
    }
}
