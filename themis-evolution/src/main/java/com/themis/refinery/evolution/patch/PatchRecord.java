package com.themis.refinery.evolution.patch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleType;

import java.time.Instant;

/**
 * Patch history entry.
 *
 * @param previousRule rule state before an in-place update; {@code null} for created rules
 */
public record PatchRecord(
    @JsonProperty("patch_id") String patchId,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("description") String description,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("rule_type") RuleType ruleType,
    @JsonProperty("applied_at") Instant appliedAt,
    @JsonProperty("action") PatchAction action,
    @JsonProperty("previous_rule") Rule previousRule,
    @JsonProperty("rolled_back") boolean rolledBack
) {

    PatchRecord markRolledBack() {
        return new PatchRecord(patchId, ruleId, description, confidence, ruleType,
                appliedAt, action, previousRule, true);
    }
}
