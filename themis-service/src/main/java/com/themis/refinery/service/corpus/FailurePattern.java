/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.corpus;

import java.util.Locale;

/**
 * Coarse classes of evaluator-reported failures.
 */
public enum FailurePattern {
    PAGE_NUMBER("page_number", "(?:페이지|page)[ \\t]*\\d+"),
    SEPARATOR("separator", "^[ \\t]*[-=_]{3,}[ \\t]*$"),
    HEADER_FOOTER("header_footer", ""),
    REFERENCE("reference", ""),
    WHITESPACE("whitespace", "[ \\t]{2,}|\\n{3,}"),
    UNKNOWN("unknown", "");

    private final String code;
    private final String residualPattern;

    FailurePattern(String code, String residualPattern) {
        this.code = code;
        this.residualPattern = residualPattern;
    }

    public String code() {
        return code;
    }

    /**
     * Regex for noise of this class that must not survive processing; blank
     * when the class has no reliable textual signature.
     */
    public String residualPattern() {
        return residualPattern;
    }

    public static FailurePattern classify(String errorMessage) {
        if (errorMessage == null) {
            return UNKNOWN;
        }
        String message = errorMessage.toLowerCase(Locale.ROOT);
        if (message.contains("페이지") || message.contains("page")) {
            return PAGE_NUMBER;
        }
        if (message.contains("구분선") || message.contains("separator")) {
            return SEPARATOR;
        }
        if (message.contains("머리글") || message.contains("바닥글")
                || message.contains("header") || message.contains("footer")) {
            return HEADER_FOOTER;
        }
        if (message.contains("참조") || message.contains("reference")) {
            return REFERENCE;
        }
        if (message.contains("공백") || message.contains("whitespace")) {
            return WHITESPACE;
        }
        return UNKNOWN;
    }
}
