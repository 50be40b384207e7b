/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

/**
 * Evaluator cost per case: input tokens plus a fixed output allowance.
 */
public record CostModel(double inputPricePerThousand, long outputTokensPerCase, double outputPricePerThousand) {

    public static CostModel defaults() {
        return new CostModel(0.01, 500, 0.03);
    }

    public double costOf(long inputTokens, long cases) {
        return inputTokens / 1000.0 * inputPricePerThousand
                + cases * (outputTokensPerCase / 1000.0 * outputPricePerThousand);
    }

    /**
     * Scales the cost of a sample to the whole corpus.
     */
    public double extrapolate(long sampleInputTokens, long sampleCases, long corpusSize) {
        if (sampleCases == 0) {
            return 0.0;
        }
        return costOf(sampleInputTokens, sampleCases) / sampleCases * corpusSize;
    }
}
