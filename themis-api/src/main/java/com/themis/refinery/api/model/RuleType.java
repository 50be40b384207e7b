/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of rule categories. Each category has its own transformation
 * strategy in the engine; the code is the persisted and wire form.
 */
public enum RuleType {
    NOISE_REMOVAL("noise_removal"),
    LEGAL_FILTERING("legal_filtering"),
    FACT_EXTRACTION("fact_extraction"),
    REDUNDANCY_REMOVAL("redundancy_removal"),
    POST_NORMALIZE("post_normalize");

    private final String code;

    RuleType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Substitution types replace every match of the pattern with the rule's replacement.
     */
    public boolean isSubstitution() {
        return this == NOISE_REMOVAL || this == REDUNDANCY_REMOVAL || this == POST_NORMALIZE;
    }

    @JsonCreator
    public static RuleType fromCode(String code) {
        return parse(code).orElseThrow(() ->
                new IllegalArgumentException("Unknown rule type: " + code));
    }

    /**
     * Lenient lookup used for evaluator-produced suggestions. Accepts the
     * legacy suggestion kinds {@code regex_improvement}, {@code new_pattern}
     * and {@code filter_enhancement}.
     */
    public static Optional<RuleType> parse(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (RuleType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return switch (normalized) {
            case "regex_improvement", "new_pattern" -> Optional.of(NOISE_REMOVAL);
            case "filter_enhancement" -> Optional.of(LEGAL_FILTERING);
            default -> Optional.empty();
        };
    }
}
