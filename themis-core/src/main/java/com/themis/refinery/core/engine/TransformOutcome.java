package com.themis.refinery.core.engine;

/**
 * Text produced by one rule and whether the rule counts as applied.
 */
public record TransformOutcome(String text, boolean applied) {

    static TransformOutcome unchanged(String text) {
        return new TransformOutcome(text, false);
    }
}
