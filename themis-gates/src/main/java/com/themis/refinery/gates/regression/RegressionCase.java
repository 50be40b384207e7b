package com.themis.refinery.gates.regression;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A document that once failed, kept so later rule sets can be checked
 * against it.
 *
 * @param residualPattern     noise that must not survive processing; blank to skip
 * @param protectedFragments  text that must survive processing
 */
public record RegressionCase(
    @JsonProperty("case_id") String caseId,
    @JsonProperty("description") String description,
    @JsonProperty("input") String input,
    @JsonProperty("residual_pattern") String residualPattern,
    @JsonProperty("protected_fragments") List<String> protectedFragments,
    @JsonProperty("recorded_at") Instant recordedAt
) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

    public RegressionCase {
        Objects.requireNonNull(caseId, "caseId");
        Objects.requireNonNull(input, "input");
        if (description == null) description = "";
        if (residualPattern == null) residualPattern = "";
        protectedFragments = protectedFragments == null ? List.of() : List.copyOf(protectedFragments);
        if (recordedAt == null) recordedAt = Instant.now();
        if (!residualPattern.isBlank()) {
            try {
                Pattern.compile(residualPattern, FLAGS);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid residual pattern for " + caseId + ": "
                        + e.getDescription(), e);
            }
        }
    }

    /**
     * True when the processed output shows the original failure again.
     */
    public boolean reproducesIn(String output) {
        if (!residualPattern.isBlank() && Pattern.compile(residualPattern, FLAGS).matcher(output).find()) {
            return true;
        }
        return protectedFragments.stream()
                .anyMatch(fragment -> input.contains(fragment) && !output.contains(fragment));
    }
}
