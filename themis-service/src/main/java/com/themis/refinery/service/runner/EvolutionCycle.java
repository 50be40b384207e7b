/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.themis.refinery.api.RulePersistence;
import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.GateType;
import com.themis.refinery.api.model.PatchSuggestion;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.api.model.RawSuggestion;
import com.themis.refinery.api.model.RuleSetVersion;
import com.themis.refinery.api.model.VersionRecord;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.core.version.VersionBump;
import com.themis.refinery.core.version.VersionManager;
import com.themis.refinery.evolution.AutoRollbackPolicy.VersionPerformance;
import com.themis.refinery.evolution.OscillationGuard;
import com.themis.refinery.evolution.PatchSynthesizer;
import com.themis.refinery.evolution.patch.PatchApplyReport;
import com.themis.refinery.evolution.patch.PatchGate;
import com.themis.refinery.evolution.patch.PatchHistory;
import com.themis.refinery.evolution.patch.RollbackOutcome;
import com.themis.refinery.gates.GateReport;
import com.themis.refinery.gates.SafetyGateRunner;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Synthesize, stage, gate and promote: the step every scale shares.
 *
 * <p>Patches are applied to a fork of the live store. The live store is
 * replaced in one step only when every safety gate passes; a rejected
 * candidate leaves it untouched. Must be called from the job thread only.
 */
public final class EvolutionCycle {
    private static final Logger logger = Logger.getLogger(EvolutionCycle.class.getName());

    private final RuleStore ruleStore;
    private final PatchSynthesizer synthesizer;
    private final OscillationGuard oscillationGuard;
    private final PatchHistory history;
    private final VersionManager versionManager;
    private final SafetyGateRunner gateRunner;
    private final double autoApplyThreshold;
    private final Tracer tracer;
    private final Telemetry telemetry;
    private final Clock clock;

    public EvolutionCycle(RuleStore ruleStore, PatchSynthesizer synthesizer, OscillationGuard oscillationGuard,
                          PatchHistory history, VersionManager versionManager, SafetyGateRunner gateRunner,
                          double autoApplyThreshold, Tracer tracer, Telemetry telemetry, Clock clock) {
        this.ruleStore = ruleStore;
        this.synthesizer = synthesizer;
        this.oscillationGuard = oscillationGuard;
        this.history = history;
        this.versionManager = versionManager;
        this.gateRunner = gateRunner;
        this.autoApplyThreshold = autoApplyThreshold;
        this.tracer = tracer;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    /**
     * Runs one cycle over the given evaluator suggestions.
     *
     * @throws PersistenceException when staging or promotion could not be saved; the
     *                              live rule set is unchanged in that case
     */
    public CycleResult run(List<RawSuggestion> suggestions, String reason) throws PersistenceException {
        Span span = tracer.spanBuilder("evolution-cycle")
                .setAttribute("reason", reason)
                .setAttribute("suggestions", suggestions.size())
                .startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<PatchSuggestion> candidates = synthesizer.synthesize(suggestions);
            if (candidates.isEmpty()) {
                logger.info(String.format("Cycle (%s): no candidate patches from %d suggestions",
                        reason, suggestions.size()));
                return CycleResult.noSuggestions(ruleStore.version());
            }

            RuleStore staging = ruleStore.fork();
            PatchHistory stagedHistory = new PatchHistory();
            PatchApplyReport applyReport = new PatchGate(staging, oscillationGuard, stagedHistory, clock)
                    .autoApply(candidates, autoApplyThreshold);
            Optional<PersistenceException> stagingFailure = applyReport.persistenceError();
            if (stagingFailure.isPresent()) {
                throw stagingFailure.get();
            }
            if (applyReport.changeCount() == 0) {
                logger.info(String.format("Cycle (%s): %d candidates, no rule changes (%d for manual review)",
                        reason, candidates.size(), applyReport.manualReview().size()));
                return new CycleResult(CycleResult.Outcome.NO_CHANGES, candidates.size(), applyReport,
                        null, null, ruleStore.version());
            }

            String candidateVersion = versionManager.incrementVersion(VersionBump.PATCH);
            String description = String.format("%s: %d auto-applied patches", reason, applyReport.changeCount());
            VersionRecord tagged = versionManager.tag(candidateVersion, staging.rules(), description);
            span.setAttribute("candidate_version", tagged.version());

            GateReport gateReport = gateRunner.runAll(candidateVersion, staging.rules());
            if (!gateReport.allPassed()) {
                versionManager.markRejected(candidateVersion);
                String failedGate = gateReport.firstFailure().map(result -> result.gateType().code()).orElse("unknown");
                telemetry.recordAlert("version_rejected", AlertSeverity.WARNING,
                        String.format("Candidate %s rejected by %s gate", candidateVersion, failedGate));
                logger.warning(String.format("Cycle (%s): candidate %s rejected by %s gate; %s stays active",
                        reason, candidateVersion, failedGate, ruleStore.version()));
                return new CycleResult(CycleResult.Outcome.REJECTED, candidates.size(), applyReport,
                        candidateVersion, gateReport, ruleStore.version());
            }

            RuleSetVersion promoted = ruleStore.replaceAll(staging.rules(), candidateVersion, description,
                    performanceSnapshot(gateReport));
            versionManager.markPromoted(candidateVersion);
            history.appendAll(stagedHistory.records());
            logger.info(String.format("Cycle (%s): promoted %s with %d rules",
                    reason, promoted.version(), promoted.rules().size()));
            return new CycleResult(CycleResult.Outcome.PROMOTED, candidates.size(), applyReport,
                    candidateVersion, gateReport, promoted.version());
        } catch (PersistenceException | RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getName() : e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Re-activates the closest promoted ancestor of the live version, or its
     * recorded parent when the ancestor was promoted before this process started.
     * The snapshot is restored as saved, so its own parent stays the next
     * rollback target. A version that was rolled back or rejected is never
     * re-activated.
     *
     * @return the version now active, empty when there is nothing to roll back to
     */
    public Optional<String> rollbackToPrevious(RulePersistence snapshots) throws PersistenceException {
        RuleSetVersion live = ruleStore.current();
        String current = live.version();
        Optional<String> target = versionManager.previousStable(current)
                .map(VersionRecord::version)
                .or(() -> Optional.ofNullable(live.parentVersion()));
        if (target.isEmpty()) {
            logger.warning("No earlier version to roll back to from " + current);
            return Optional.empty();
        }
        Optional<VersionRecord.Status> targetStatus = versionManager.find(target.get()).map(VersionRecord::status);
        if (targetStatus.isPresent() && !isRestorable(targetStatus.get())) {
            logger.warning(String.format("Refusing to roll back %s to %s: it was %s",
                    current, target.get(), targetStatus.get()));
            return Optional.empty();
        }
        Optional<RuleSetVersion> snapshot = snapshots.loadVersion(target.get());
        if (snapshot.isEmpty()) {
            logger.warning("Snapshot of " + target.get() + " is no longer retained");
            return Optional.empty();
        }
        RuleSetVersion restored = ruleStore.restore(snapshot.get());
        if (versionManager.find(current).isPresent()) {
            versionManager.markRolledBack(current);
        }
        telemetry.recordAlert("version_rollback", AlertSeverity.CRITICAL,
                String.format("Rolled back %s to %s", current, restored.version()));
        return Optional.of(restored.version());
    }

    /**
     * Undoes one applied patch on the live rule set and promotes the result
     * as a new patch version. Safety gates are not run: the result only
     * removes or reverts an earlier change.
     */
    public PatchRollbackResult rollbackPatch(String patchId) throws PersistenceException {
        RuleSetVersion live = ruleStore.current();
        RuleStore staging = ruleStore.fork();
        PatchHistory stagedHistory = history.copy();
        RollbackOutcome outcome = new PatchGate(staging, oscillationGuard, stagedHistory, clock).rollback(patchId);
        if (!outcome.success()) {
            logger.warning(String.format("Patch rollback of %s refused: %s", patchId, outcome.message()));
            return new PatchRollbackResult(outcome, live.version());
        }

        String version = versionManager.incrementVersion(VersionBump.PATCH);
        String description = "rollback of patch " + patchId;
        versionManager.tag(version, staging.rules(), description);
        RuleSetVersion promoted = ruleStore.replaceAll(staging.rules(), version, description,
                live.performanceSnapshot());
        versionManager.markPromoted(version);
        history.replaceWith(stagedHistory);
        telemetry.recordAlert("patch_rollback", AlertSeverity.WARNING,
                String.format("Patch %s rolled back in %s: %s", patchId, version, outcome.message()));
        logger.info(String.format("Patch %s rolled back, promoted %s", patchId, promoted.version()));
        return new PatchRollbackResult(outcome, promoted.version());
    }

    private static boolean isRestorable(VersionRecord.Status status) {
        return status != VersionRecord.Status.ROLLED_BACK && status != VersionRecord.Status.REJECTED;
    }

    /**
     * Holdout metrics of a passed gate run, in the shape stored with each version.
     */
    static Map<String, Double> performanceSnapshot(GateReport report) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        for (GateResult result : report.results()) {
            snapshot.put(result.gateType().code() + "_score", result.score());
            if (result.gateType() == GateType.HOLDOUT && result.details().get("metrics") instanceof QualityMetrics m) {
                int sampleSize = ((Number) result.details().getOrDefault("sample_size", 0)).intValue();
                int degraded = ((Number) result.details().getOrDefault("degraded_evaluations", 0)).intValue();
                double errorRate = sampleSize == 0 ? 0.0 : (double) degraded / sampleSize;
                snapshot.putAll(new VersionPerformance(m.nrr(), m.fprOrIcr(), m.ss(), errorRate).toSnapshot());
                snapshot.put("token_reduction", m.tokenReduction());
            }
        }
        return snapshot;
    }
}
