package com.themis.refinery.evolution.patch;

import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.PatchSuggestion;

import java.util.List;
import java.util.Optional;

/**
 * Partition of candidate patches produced by {@link PatchGate#autoApply}.
 * Every candidate ends up in exactly one of the three lists.
 */
public record PatchApplyReport(
    List<AppliedPatch> autoApplied,
    List<ReviewItem> manualReview,
    List<FailedPatch> failed,
    PersistenceException persistenceFailure
) {

    public PatchApplyReport {
        autoApplied = List.copyOf(autoApplied);
        manualReview = List.copyOf(manualReview);
        failed = List.copyOf(failed);
    }

    public static PatchApplyReport empty() {
        return new PatchApplyReport(List.of(), List.of(), List.of(), null);
    }

    public int total() {
        return autoApplied.size() + manualReview.size() + failed.size();
    }

    /**
     * Number of patches that actually changed the rule set.
     */
    public long changeCount() {
        return autoApplied.stream().filter(applied -> applied.action() != PatchAction.ALREADY_PRESENT).count();
    }

    /**
     * Set when a save failed; the caller must halt its cycle.
     */
    public Optional<PersistenceException> persistenceError() {
        return Optional.ofNullable(persistenceFailure);
    }

    public record AppliedPatch(PatchSuggestion suggestion, String ruleId, PatchAction action) {
    }

    public record ReviewItem(PatchSuggestion suggestion, String reason) {
    }

    public record FailedPatch(PatchSuggestion suggestion, String error) {
    }
}
