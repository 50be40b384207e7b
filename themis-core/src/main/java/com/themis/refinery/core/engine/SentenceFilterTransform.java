package com.themis.refinery.core.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Drops whole sentences that contain a match.
 *
 * <p>Sentences end at {@code .}, {@code !} or {@code ?} followed by whitespace;
 * surviving sentences are re-joined with {@code ". "}. When nothing is
 * dropped the input comes back untouched.
 */
final class SentenceFilterTransform implements TextTransform {

    static final SentenceFilterTransform INSTANCE = new SentenceFilterTransform();

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]\\s+");

    private SentenceFilterTransform() {
    }

    @Override
    public TransformOutcome apply(String text, Pattern pattern, String replacement) {
        String[] sentences = SENTENCE_BOUNDARY.split(text, -1);
        List<String> kept = new ArrayList<>(sentences.length);
        boolean dropped = false;

        for (String sentence : sentences) {
            if (pattern.matcher(sentence).find()) {
                dropped = true;
            } else {
                kept.add(sentence);
            }
        }

        if (!dropped) {
            return TransformOutcome.unchanged(text);
        }
        return new TransformOutcome(String.join(". ", kept), true);
    }
}
