package com.themis.refinery.core.store;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectSet;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-level Jaccard similarity between two regex patterns.
 *
 * <p>Escape sequences such as {@code \d} are removed first; the remaining
 * runs of letters and digits longer than one character form the token set.
 */
public final class PatternSimilarity {

    /** Similarity at or above which two patterns of the same type are duplicates. */
    public static final double DUPLICATE_THRESHOLD = 0.8;

    private static final Pattern ESCAPE = Pattern.compile("\\\\[\\p{Alpha}]");
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    private PatternSimilarity() {
    }

    public static double jaccard(String first, String second) {
        ObjectSet<String> a = tokens(first);
        ObjectSet<String> b = tokens(second);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        int intersection = 0;
        for (String token : a) {
            if (b.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }

    public static boolean isDuplicate(String first, String second) {
        return first.equals(second) || jaccard(first, second) >= DUPLICATE_THRESHOLD;
    }

    static ObjectSet<String> tokens(String pattern) {
        ObjectSet<String> tokens = new ObjectOpenHashSet<>();
        if (pattern == null) {
            return tokens;
        }
        String stripped = ESCAPE.matcher(pattern.toLowerCase(Locale.ROOT)).replaceAll(" ");
        Matcher matcher = TOKEN.matcher(stripped);
        while (matcher.find()) {
            if (matcher.group().length() > 1) {
                tokens.add(matcher.group());
            }
        }
        return tokens;
    }
}
