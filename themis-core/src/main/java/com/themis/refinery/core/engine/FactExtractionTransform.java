package com.themis.refinery.core.engine;

import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps only the matched text, one match per line. A text without any match
 * is left as it is rather than emptied.
 */
final class FactExtractionTransform implements TextTransform {

    static final FactExtractionTransform INSTANCE = new FactExtractionTransform();

    private FactExtractionTransform() {
    }

    @Override
    public TransformOutcome apply(String text, Pattern pattern, String replacement) {
        Matcher matcher = pattern.matcher(text);
        StringJoiner facts = new StringJoiner("\n");
        int matches = 0;
        while (matcher.find()) {
            if (!matcher.group().isEmpty()) {
                facts.add(matcher.group());
                matches++;
            }
        }
        if (matches == 0) {
            return TransformOutcome.unchanged(text);
        }
        String result = facts.toString();
        return new TransformOutcome(result, !result.equals(text));
    }
}
