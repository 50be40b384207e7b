/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.processing;

import java.util.regex.Pattern;

/**
 * Rough token count: whitespace-separated words times 1.3.
 */
public final class TokenEstimator {

    public static final double TOKENS_PER_WORD = 1.3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TokenEstimator() {
    }

    public static long estimate(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int words = WHITESPACE.split(text.strip()).length;
        return (long) (words * TOKENS_PER_WORD);
    }
}
