package com.themis.refinery.evolution;

import com.themis.refinery.api.exception.PatchSynthesisException;
import com.themis.refinery.api.model.PatchSuggestion;
import com.themis.refinery.api.model.RawSuggestion;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleType;
import com.themis.refinery.core.store.PatternSimilarity;
import com.themis.refinery.core.store.RuleStore;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns raw evaluator suggestions into candidate patches.
 *
 * <p>Suggestions are dropped when malformed, below the synthesis threshold,
 * or near-duplicates of an enabled rule of the same type (or of a candidate
 * accepted earlier in the same call). Input order is preserved.
 */
public final class PatchSynthesizer {
    private static final Logger logger = Logger.getLogger(PatchSynthesizer.class.getName());

    public static final double DEFAULT_SYNTHESIS_THRESHOLD = 0.7;

    private static final DateTimeFormatter ID_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final RuleStore ruleStore;
    private final double synthesisThreshold;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public PatchSynthesizer(RuleStore ruleStore) {
        this(ruleStore, DEFAULT_SYNTHESIS_THRESHOLD, Clock.systemUTC());
    }

    public PatchSynthesizer(RuleStore ruleStore, double synthesisThreshold, Clock clock) {
        if (synthesisThreshold < 0.0 || synthesisThreshold > 1.0) {
            throw new IllegalArgumentException("Synthesis threshold must be between 0.0 and 1.0");
        }
        this.ruleStore = ruleStore;
        this.synthesisThreshold = synthesisThreshold;
        this.clock = clock;
    }

    public List<PatchSuggestion> synthesize(List<RawSuggestion> suggestions) {
        List<Rule> existing = ruleStore.rules();
        List<PatchSuggestion> accepted = new ArrayList<>();
        int malformed = 0;
        int belowThreshold = 0;
        int duplicates = 0;

        for (RawSuggestion raw : suggestions) {
            PatchSuggestion candidate;
            try {
                candidate = validate(raw);
            } catch (PatchSynthesisException e) {
                malformed++;
                logger.warning("Skipping malformed suggestion: " + e.getMessage());
                continue;
            }

            if (candidate.confidenceScore() < synthesisThreshold) {
                belowThreshold++;
                continue;
            }
            if (duplicatesExisting(candidate, existing) || duplicatesAccepted(candidate, accepted)) {
                duplicates++;
                continue;
            }
            accepted.add(candidate);
        }

        logger.info(String.format(
                "Synthesized %d of %d suggestions (%d below %.2f, %d duplicates, %d malformed)",
                accepted.size(), suggestions.size(), belowThreshold, synthesisThreshold,
                duplicates, malformed));
        return accepted;
    }

    public double synthesisThreshold() {
        return synthesisThreshold;
    }

    private PatchSuggestion validate(RawSuggestion raw) {
        if (raw == null) {
            throw new PatchSynthesisException("null suggestion");
        }
        RuleType type = RuleType.parse(raw.ruleType())
                .orElseThrow(() -> new PatchSynthesisException("unknown rule type '" + raw.ruleType() + "'"));
        Double confidence = raw.confidenceScore();
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw new PatchSynthesisException("confidence out of range: " + confidence);
        }

        PatchSuggestion candidate = new PatchSuggestion(
                nextSuggestionId(),
                raw.description() == null || raw.description().isBlank()
                        ? "evaluator suggestion" : raw.description().trim(),
                type,
                confidence,
                raw.patternBefore(),
                raw.patternAfter(),
                raw.estimatedImprovement(),
                raw.applicableCases(),
                clock.instant());

        if (candidate.targetPattern().isBlank()) {
            throw new PatchSynthesisException("suggestion carries no pattern");
        }
        try {
            Pattern.compile(candidate.targetPattern());
        } catch (PatternSyntaxException e) {
            throw new PatchSynthesisException("pattern does not compile: " + e.getDescription(), e);
        }
        return candidate;
    }

    private static boolean duplicatesExisting(PatchSuggestion candidate, List<Rule> existing) {
        return existing.stream()
                .filter(Rule::enabled)
                .filter(rule -> rule.type() == candidate.ruleType())
                .anyMatch(rule -> PatternSimilarity.isDuplicate(rule.pattern(), candidate.targetPattern()));
    }

    private static boolean duplicatesAccepted(PatchSuggestion candidate, List<PatchSuggestion> accepted) {
        return accepted.stream()
                .filter(other -> other.ruleType() == candidate.ruleType())
                .anyMatch(other -> PatternSimilarity.isDuplicate(other.targetPattern(), candidate.targetPattern()));
    }

    private String nextSuggestionId() {
        return "patch_" + ID_TIMESTAMP.format(clock.instant()) + "_" + sequence.incrementAndGet();
    }
}
