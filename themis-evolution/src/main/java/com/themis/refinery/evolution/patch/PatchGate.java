package com.themis.refinery.evolution.patch;

import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.PatchSuggestion;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleType;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.evolution.OscillationGuard;
import com.themis.refinery.evolution.patch.PatchApplyReport.AppliedPatch;
import com.themis.refinery.evolution.patch.PatchApplyReport.FailedPatch;
import com.themis.refinery.evolution.patch.PatchApplyReport.ReviewItem;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies confident candidate patches to a rule store and defers the rest.
 *
 * <p>Order of checks per candidate: confidence, oscillation, duplicate, then
 * the write. A failed save marks the candidate and every remaining one as
 * failed and is surfaced through {@link PatchApplyReport#persistenceError()};
 * the store itself never exposes a partial write.
 */
public final class PatchGate {
    private static final Logger logger = Logger.getLogger(PatchGate.class.getName());

    static final String OSCILLATION = "oscillation";
    static final String IMPROVED_SUFFIX = " (auto-improved)";

    private final RuleStore ruleStore;
    private final OscillationGuard oscillationGuard;
    private final PatchHistory history;
    private final Clock clock;

    public PatchGate(RuleStore ruleStore, OscillationGuard oscillationGuard, PatchHistory history) {
        this(ruleStore, oscillationGuard, history, Clock.systemUTC());
    }

    public PatchGate(RuleStore ruleStore, OscillationGuard oscillationGuard, PatchHistory history, Clock clock) {
        this.ruleStore = ruleStore;
        this.oscillationGuard = oscillationGuard;
        this.history = history;
        this.clock = clock;
    }

    public PatchApplyReport autoApply(List<PatchSuggestion> candidates, double autoThreshold) {
        if (autoThreshold < 0.0 || autoThreshold > 1.0) {
            throw new IllegalArgumentException("Auto-apply threshold must be between 0.0 and 1.0");
        }

        List<AppliedPatch> autoApplied = new ArrayList<>();
        List<ReviewItem> manualReview = new ArrayList<>();
        List<FailedPatch> failed = new ArrayList<>();
        PersistenceException persistenceFailure = null;

        for (PatchSuggestion candidate : candidates) {
            if (persistenceFailure != null) {
                failed.add(new FailedPatch(candidate, "halted after persistence failure"));
                continue;
            }
            if (candidate.confidenceScore() < autoThreshold) {
                manualReview.add(new ReviewItem(candidate, String.format(
                        "confidence %.2f below auto-apply threshold %.2f",
                        candidate.confidenceScore(), autoThreshold)));
                continue;
            }
            if (oscillationGuard.checkOscillation(candidate.ruleType())) {
                manualReview.add(new ReviewItem(candidate, OSCILLATION));
                continue;
            }

            try {
                AppliedPatch applied = apply(candidate);
                if (applied.action() != PatchAction.ALREADY_PRESENT) {
                    oscillationGuard.trackChange(candidate.ruleType());
                }
                autoApplied.add(applied);
            } catch (PersistenceException e) {
                logger.log(Level.SEVERE, "Failed to persist patch " + candidate.suggestionId(), e);
                failed.add(new FailedPatch(candidate, e.getMessage()));
                persistenceFailure = e;
            }
        }

        logger.info(String.format("Patch gate: %d applied, %d for review, %d failed",
                autoApplied.size(), manualReview.size(), failed.size()));
        return new PatchApplyReport(autoApplied, manualReview, failed, persistenceFailure);
    }

    /**
     * Undoes a patch: a created rule is disabled, an updated rule gets its
     * previous pattern, description and score back while keeping its usage
     * count and enabled flag. Nothing is deleted.
     */
    public RollbackOutcome rollback(String patchId) throws PersistenceException {
        Optional<PatchRecord> found = history.find(patchId);
        if (found.isEmpty()) {
            return RollbackOutcome.failure("Unknown patch: " + patchId);
        }
        PatchRecord record = found.get();
        if (record.rolledBack()) {
            return RollbackOutcome.failure("Patch already rolled back: " + patchId);
        }

        if (record.action() == PatchAction.UPDATED && record.previousRule() != null) {
            Optional<Rule> current = ruleStore.findById(record.ruleId());
            if (current.isEmpty()) {
                return RollbackOutcome.failure("Rule not found: " + record.ruleId());
            }
            Rule previous = record.previousRule();
            ruleStore.upsertOne(current.get().withImprovedPattern(previous.pattern(), previous.description(),
                    previous.performanceScore(), clock.instant()));
            history.markRolledBack(patchId);
            logger.info("Rolled back patch " + patchId + ", restored pattern of rule " + record.ruleId());
            return RollbackOutcome.success("Restored previous pattern of rule " + record.ruleId());
        }

        if (ruleStore.disable(record.ruleId()).isEmpty()) {
            return RollbackOutcome.failure("Rule not found: " + record.ruleId());
        }
        history.markRolledBack(patchId);
        logger.info("Rolled back patch " + patchId + ", disabled rule " + record.ruleId());
        return RollbackOutcome.success("Disabled rule " + record.ruleId());
    }

    public static String ruleIdFor(PatchSuggestion suggestion) {
        return "ai_" + suggestion.ruleType().code() + "_" + suggestion.suggestionId();
    }

    static int priorityFor(RuleType type) {
        return switch (type) {
            case NOISE_REMOVAL -> 80;
            case LEGAL_FILTERING -> 70;
            case REDUNDANCY_REMOVAL -> 60;
            case FACT_EXTRACTION -> 50;
            case POST_NORMALIZE -> 40;
        };
    }

    private AppliedPatch apply(PatchSuggestion candidate) throws PersistenceException {
        Instant now = clock.instant();
        Optional<Rule> improvable = improvableRule(candidate);
        if (improvable.isPresent()) {
            Rule existing = improvable.get();
            Rule improved = existing.withImprovedPattern(candidate.patternAfter(),
                    existing.description() + IMPROVED_SUFFIX, candidate.confidenceScore(), now);
            Optional<Rule> duplicate = ruleStore.findDuplicate(improved);
            if (duplicate.isPresent()) {
                return new AppliedPatch(candidate, duplicate.get().ruleId(), PatchAction.ALREADY_PRESENT);
            }
            ruleStore.upsertOne(improved);
            history.append(record(candidate, improved.ruleId(), PatchAction.UPDATED, existing, now));
            return new AppliedPatch(candidate, improved.ruleId(), PatchAction.UPDATED);
        }

        Rule created = new Rule(ruleIdFor(candidate), candidate.ruleType(), candidate.targetPattern(), "",
                priorityFor(candidate.ruleType()), true, candidate.description(),
                candidate.confidenceScore(), 0L, now, now);
        Optional<Rule> duplicate = ruleStore.findById(created.ruleId())
                .filter(Rule::enabled)
                .or(() -> ruleStore.findDuplicate(created));
        if (duplicate.isPresent()) {
            return new AppliedPatch(candidate, duplicate.get().ruleId(), PatchAction.ALREADY_PRESENT);
        }
        ruleStore.upsertOne(created);
        history.append(record(candidate, created.ruleId(), PatchAction.CREATED, null, now));
        return new AppliedPatch(candidate, created.ruleId(), PatchAction.CREATED);
    }

    private Optional<Rule> improvableRule(PatchSuggestion candidate) {
        if (candidate.patternBefore().isBlank()
                || candidate.patternAfter().isBlank()
                || candidate.patternAfter().equals(candidate.patternBefore())) {
            return Optional.empty();
        }
        return ruleStore.findByPattern(candidate.patternBefore());
    }

    private static PatchRecord record(PatchSuggestion candidate, String ruleId, PatchAction action,
                                      Rule previous, Instant at) {
        return new PatchRecord(candidate.suggestionId(), ruleId, candidate.description(),
                candidate.confidenceScore(), candidate.ruleType(), at, action, previous, false);
    }
}
