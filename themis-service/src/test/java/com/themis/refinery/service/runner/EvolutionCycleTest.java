package com.themis.refinery.service.runner;

import com.themis.refinery.api.RulePersistence;
import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.GateType;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.api.model.RawSuggestion;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.VersionRecord;
import com.themis.refinery.core.engine.DefaultRules;
import com.themis.refinery.core.persistence.InMemoryRulePersistence;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.core.version.VersionManager;
import com.themis.refinery.evolution.OscillationGuard;
import com.themis.refinery.evolution.PatchSynthesizer;
import com.themis.refinery.evolution.patch.PatchHistory;
import com.themis.refinery.evolution.patch.PatchRecord;
import com.themis.refinery.gates.GateReport;
import com.themis.refinery.gates.SafetyGate;
import com.themis.refinery.gates.SafetyGateRunner;
import com.themis.refinery.service.FootnoteEvaluator;
import com.themis.refinery.service.MutableClock;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvolutionCycleTest {

    private static final RawSuggestion FOOTNOTE = new RawSuggestion("각주 번호 제거", 0.9, "noise_removal",
            null, FootnoteEvaluator.FOOTNOTE_PATTERN, "nrr +0.15", List.of("case-0001"));

    private MutableClock clock;
    private Telemetry telemetry;
    private InMemoryRulePersistence persistence;
    private RuleStore store;
    private VersionManager versions;
    private PatchHistory history;

    @BeforeEach
    void setUp() throws PersistenceException {
        clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
        telemetry = mock(Telemetry.class);
        persistence = new InMemoryRulePersistence();
        store = new RuleStore(persistence, DefaultRules.bootstrap(), clock);
        store.loadLatest();
        versions = new VersionManager(store.version(), clock);
        history = new PatchHistory();
    }

    private EvolutionCycle cycle(RuleStore ruleStore, SafetyGate... gates) {
        SafetyGateRunner runner = new SafetyGateRunner(List.of(gates),
                OpenTelemetry.noop().getTracer("test"), telemetry);
        OscillationGuard guard = new OscillationGuard(OscillationGuard.DEFAULT_WINDOW,
                OscillationGuard.DEFAULT_COOLDOWN, clock, telemetry);
        return new EvolutionCycle(ruleStore, new PatchSynthesizer(ruleStore, 0.7, clock), guard, history,
                versions, runner, 0.8, OpenTelemetry.noop().getTracer("test"), telemetry, clock);
    }

    @Test
    @DisplayName("Passing gates promote the staged rules and merge the patch history")
    void promotesWhenGatesPass() throws PersistenceException {
        FixedGate unit = new FixedGate(GateType.UNIT, true);

        CycleResult result = cycle(store, unit).run(List.of(FOOTNOTE), "test");

        assertThat(result.outcome()).isEqualTo(CycleResult.Outcome.PROMOTED);
        assertThat(result.candidateVersion()).isEqualTo("v1.0.1");
        assertThat(store.version()).isEqualTo("v1.0.1");
        assertThat(store.rules()).extracting(Rule::pattern).contains(FootnoteEvaluator.FOOTNOTE_PATTERN);
        assertThat(versions.activeVersion()).isEqualTo("v1.0.1");
        assertThat(versions.find("v1.0.1")).map(VersionRecord::status).contains(VersionRecord.Status.PROMOTED);
        assertThat(history.size()).isEqualTo(1);
        assertThat(persistence.loadVersion("v1.0.1")).isPresent();
    }

    @Test
    @DisplayName("A failing gate rejects the candidate and leaves the live rules untouched")
    void rejectsWhenAGateFails() throws PersistenceException {
        List<Rule> before = store.rules();
        FixedGate unit = new FixedGate(GateType.UNIT, true);
        FixedGate regression = new FixedGate(GateType.REGRESSION, false);
        FixedGate holdout = new FixedGate(GateType.HOLDOUT, true);

        CycleResult result = cycle(store, unit, regression, holdout).run(List.of(FOOTNOTE), "test");

        assertThat(result.outcome()).isEqualTo(CycleResult.Outcome.REJECTED);
        assertThat(result.gateReport().results()).extracting(GateResult::gateType)
                .containsExactly(GateType.UNIT, GateType.REGRESSION);
        assertThat(holdout.runs()).isZero();
        assertThat(store.rules()).isEqualTo(before);
        assertThat(store.version()).isEqualTo("v1.0.0");
        assertThat(versions.find("v1.0.1")).map(VersionRecord::status).contains(VersionRecord.Status.REJECTED);
        assertThat(history.size()).isZero();
        verify(telemetry).recordAlert(eq("version_rejected"), eq(AlertSeverity.WARNING), anyString());
    }

    @Test
    void rejectedVersionNumbersAreNotReused() throws PersistenceException {
        cycle(store, new FixedGate(GateType.UNIT, false)).run(List.of(FOOTNOTE), "first");

        CycleResult second = cycle(store, new FixedGate(GateType.UNIT, true)).run(List.of(FOOTNOTE), "second");

        assertThat(second.candidateVersion()).isEqualTo("v1.0.2");
    }

    @Test
    void noSuggestionsMeansNoVersion() throws PersistenceException {
        CycleResult result = cycle(store, new FixedGate(GateType.UNIT, true)).run(List.of(), "test");

        assertThat(result.outcome()).isEqualTo(CycleResult.Outcome.NO_SUGGESTIONS);
        assertThat(versions.records()).isEmpty();
    }

    @Test
    @DisplayName("Candidates below the auto-apply threshold go to review without a new version")
    void lowConfidenceCandidatesChangeNothing() throws PersistenceException {
        RawSuggestion unsure = new RawSuggestion("각주 번호 제거", 0.75, "noise_removal",
                null, FootnoteEvaluator.FOOTNOTE_PATTERN, "", List.of());

        CycleResult result = cycle(store, new FixedGate(GateType.UNIT, true)).run(List.of(unsure), "test");

        assertThat(result.outcome()).isEqualTo(CycleResult.Outcome.NO_CHANGES);
        assertThat(result.applyReport().manualReview()).hasSize(1);
        assertThat(store.version()).isEqualTo("v1.0.0");
        assertThat(versions.records()).isEmpty();
    }

    @Test
    @DisplayName("A failed save during promotion propagates and the live rules stay as they were")
    void persistenceFailureHaltsTheCycle() throws PersistenceException {
        RulePersistence failing = mock(RulePersistence.class);
        when(failing.loadLatestVersion()).thenReturn(Optional.empty());
        RuleStore live = new RuleStore(failing, DefaultRules.bootstrap(), clock);
        live.loadLatest();
        List<Rule> before = live.rules();
        doThrow(new PersistenceException("disk full")).when(failing).saveVersion(any());

        EvolutionCycle cycle = cycle(live, new FixedGate(GateType.UNIT, true));

        assertThatThrownBy(() -> cycle.run(List.of(FOOTNOTE), "test"))
                .isInstanceOf(PersistenceException.class)
                .hasMessage("disk full");
        assertThat(live.rules()).isEqualTo(before);
        assertThat(live.version()).isEqualTo("v1.0.0");
        assertThat(history.size()).isZero();
    }

    @Test
    void performanceSnapshotCarriesHoldoutMetrics() {
        QualityMetrics metrics = new QualityMetrics(0.95, 0.99, 0.93, 28.0, 0);
        GateReport report = new GateReport("v1.0.1", List.of(
                GateResult.passed(GateType.UNIT, 1.0, Map.of()),
                GateResult.passed(GateType.HOLDOUT, metrics.compositeScore(),
                        Map.of("metrics", metrics, "sample_size", 20, "degraded_evaluations", 1))));

        Map<String, Double> snapshot = EvolutionCycle.performanceSnapshot(report);

        assertThat(snapshot).containsEntry("nrr", 0.95)
                .containsEntry("fpr", 0.99)
                .containsEntry("ss", 0.93)
                .containsEntry("error_rate", 0.05)
                .containsEntry("token_reduction", 28.0)
                .containsEntry("unit_score", 1.0);
    }

    @Nested
    class Rollback {

        @Test
        void restoresTheParentVersion() throws PersistenceException {
            EvolutionCycle cycle = cycle(store, new FixedGate(GateType.UNIT, true));
            cycle.run(List.of(FOOTNOTE), "test");

            Optional<String> restored = cycle.rollbackToPrevious(persistence);

            assertThat(restored).contains("v1.0.0");
            assertThat(store.version()).isEqualTo("v1.0.0");
            assertThat(store.rules()).extracting(Rule::pattern)
                    .doesNotContain(FootnoteEvaluator.FOOTNOTE_PATTERN);
            assertThat(versions.find("v1.0.1")).map(VersionRecord::status)
                    .contains(VersionRecord.Status.ROLLED_BACK);
            verify(telemetry).recordAlert(eq("version_rollback"), eq(AlertSeverity.CRITICAL), anyString());
        }

        @Test
        void nothingToRollBackToFromTheInitialVersion() throws PersistenceException {
            assertThat(cycle(store, new FixedGate(GateType.UNIT, true)).rollbackToPrevious(persistence)).isEmpty();
            assertThat(store.version()).isEqualTo("v1.0.0");
        }

        @Test
        @DisplayName("A second rollback from the restored initial version does not bring the rolled-back one back")
        void secondRollbackIsANoOp() throws PersistenceException {
            EvolutionCycle cycle = cycle(store, new FixedGate(GateType.UNIT, true));
            cycle.run(List.of(FOOTNOTE), "test");

            assertThat(cycle.rollbackToPrevious(persistence)).contains("v1.0.0");
            assertThat(store.current().parentVersion()).isNull();

            assertThat(cycle.rollbackToPrevious(persistence)).isEmpty();
            assertThat(store.version()).isEqualTo("v1.0.0");
            assertThat(store.rules()).extracting(Rule::pattern)
                    .doesNotContain(FootnoteEvaluator.FOOTNOTE_PATTERN);
        }

        @Test
        void refusesToReactivateARolledBackVersion() throws PersistenceException {
            EvolutionCycle cycle = cycle(store, new FixedGate(GateType.UNIT, true));
            cycle.run(List.of(FOOTNOTE), "test");
            versions.markRolledBack("v1.0.1");
            store.replaceAll(store.rules(), "v1.0.2", "manual edit", Map.of());

            assertThat(cycle.rollbackToPrevious(persistence)).isEmpty();
            assertThat(store.version()).isEqualTo("v1.0.2");
        }
    }

    @Nested
    class PatchRollback {

        @Test
        @DisplayName("Undoing a created rule disables it and promotes a new patch version")
        void disablesTheCreatedRuleInANewVersion() throws PersistenceException {
            EvolutionCycle cycle = cycle(store, new FixedGate(GateType.UNIT, true));
            cycle.run(List.of(FOOTNOTE), "test");
            PatchRecord applied = history.records().get(0);

            PatchRollbackResult result = cycle.rollbackPatch(applied.patchId());

            assertThat(result.success()).isTrue();
            assertThat(result.activeVersion()).isEqualTo("v1.0.2");
            assertThat(store.version()).isEqualTo("v1.0.2");
            assertThat(store.current().parentVersion()).isEqualTo("v1.0.1");
            assertThat(store.findById(applied.ruleId())).map(Rule::enabled).contains(false);
            assertThat(history.find(applied.patchId())).map(PatchRecord::rolledBack).contains(true);

            VersionRecord tagged = versions.find("v1.0.2").orElseThrow();
            assertThat(tagged.status()).isEqualTo(VersionRecord.Status.PROMOTED);
            assertThat(versions.verify(store.rules(), tagged.checksum())).isTrue();
            assertThat(versions.activeVersion()).isEqualTo("v1.0.2");
        }

        @Test
        void unknownPatchLeavesTheLiveVersionAlone() throws PersistenceException {
            EvolutionCycle cycle = cycle(store, new FixedGate(GateType.UNIT, true));
            cycle.run(List.of(FOOTNOTE), "test");

            PatchRollbackResult result = cycle.rollbackPatch("no-such-patch");

            assertThat(result.success()).isFalse();
            assertThat(result.outcome().message()).contains("Unknown patch");
            assertThat(store.version()).isEqualTo("v1.0.1");
            assertThat(versions.find("v1.0.2")).isEmpty();
        }

        @Test
        void aPatchIsRolledBackOnlyOnce() throws PersistenceException {
            EvolutionCycle cycle = cycle(store, new FixedGate(GateType.UNIT, true));
            cycle.run(List.of(FOOTNOTE), "test");
            String patchId = history.records().get(0).patchId();
            cycle.rollbackPatch(patchId);

            PatchRollbackResult again = cycle.rollbackPatch(patchId);

            assertThat(again.success()).isFalse();
            assertThat(again.outcome().message()).contains("already rolled back");
            assertThat(store.version()).isEqualTo("v1.0.2");
        }
    }
}
