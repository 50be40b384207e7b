package com.themis.refinery.core.engine;

import com.themis.refinery.api.model.RuleType;

import java.util.regex.Pattern;

/**
 * Maps each rule type to its strategy and regex flags.
 */
public final class TextTransforms {

    private static final int SUBSTITUTION_FLAGS =
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final int MATCH_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private TextTransforms() {
    }

    public static TextTransform forType(RuleType type) {
        return switch (type) {
            case NOISE_REMOVAL, REDUNDANCY_REMOVAL, POST_NORMALIZE -> SubstitutionTransform.INSTANCE;
            case LEGAL_FILTERING -> SentenceFilterTransform.INSTANCE;
            case FACT_EXTRACTION -> FactExtractionTransform.INSTANCE;
        };
    }

    public static int flagsFor(RuleType type) {
        return switch (type) {
            case NOISE_REMOVAL, REDUNDANCY_REMOVAL, POST_NORMALIZE -> SUBSTITUTION_FLAGS;
            case LEGAL_FILTERING, FACT_EXTRACTION -> MATCH_FLAGS;
        };
    }
}
