package com.themis.refinery.core.engine;

import java.util.regex.Pattern;

/**
 * Replaces every match with the rule's replacement. The replacement uses
 * {@link java.util.regex.Matcher#replaceAll(String)} syntax ({@code $1} for groups).
 */
final class SubstitutionTransform implements TextTransform {

    static final SubstitutionTransform INSTANCE = new SubstitutionTransform();

    private SubstitutionTransform() {
    }

    @Override
    public TransformOutcome apply(String text, Pattern pattern, String replacement) {
        String result = pattern.matcher(text).replaceAll(replacement);
        return new TransformOutcome(result, !result.equals(text));
    }
}
