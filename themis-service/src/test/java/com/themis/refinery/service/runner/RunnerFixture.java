package com.themis.refinery.service.runner;

import com.themis.refinery.api.Evaluator;
import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.core.engine.DefaultRules;
import com.themis.refinery.core.engine.RuleEngine;
import com.themis.refinery.core.persistence.InMemoryRulePersistence;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.core.version.VersionManager;
import com.themis.refinery.evolution.OscillationGuard;
import com.themis.refinery.evolution.PatchSynthesizer;
import com.themis.refinery.evolution.patch.PatchHistory;
import com.themis.refinery.gates.QualityThresholds;
import com.themis.refinery.gates.SafetyGate;
import com.themis.refinery.gates.SafetyGateRunner;
import com.themis.refinery.gates.holdout.HoldoutGate;
import com.themis.refinery.gates.regression.RegressionGate;
import com.themis.refinery.gates.regression.RegressionSuite;
import com.themis.refinery.gates.unit.UnitGate;
import com.themis.refinery.service.MutableClock;
import com.themis.refinery.service.processing.BoundedBatchExecutor;
import com.themis.refinery.service.processing.CaseProcessor;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.time.Instant;
import java.util.List;

/**
 * In-memory rule store, version lineage, gates and processor around one evaluator.
 */
final class RunnerFixture implements AutoCloseable {

    final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
    final Tracer tracer = OpenTelemetry.noop().getTracer("test");
    final QualityThresholds thresholds = QualityThresholds.defaults();
    final InMemoryRulePersistence persistence = new InMemoryRulePersistence();
    final RuleStore store;
    final VersionManager versions;
    final RegressionSuite suite = new RegressionSuite();
    final PatchHistory history = new PatchHistory();
    final RuleEngine gateEngine = new RuleEngine();
    final EvolutionCycle cycle;
    final CaseProcessor processor;
    final RegressionRecorder recorder;
    final BoundedBatchExecutor executor = new BoundedBatchExecutor(4, "test-runner");

    RunnerFixture(Evaluator evaluator, List<DocumentCase> holdout) throws PersistenceException {
        store = new RuleStore(persistence, DefaultRules.bootstrap(), clock);
        store.loadLatest();
        versions = new VersionManager(store.version(), clock);
        List<SafetyGate> gates = List.of(
                new UnitGate(gateEngine),
                new RegressionGate(gateEngine, suite),
                new HoldoutGate(gateEngine, evaluator, () -> holdout, thresholds));
        SafetyGateRunner gateRunner = new SafetyGateRunner(gates, tracer, Telemetry.noop());
        OscillationGuard guard = new OscillationGuard(OscillationGuard.DEFAULT_WINDOW,
                OscillationGuard.DEFAULT_COOLDOWN, clock, Telemetry.noop());
        cycle = new EvolutionCycle(store, new PatchSynthesizer(store, 0.7, clock), guard, history, versions,
                gateRunner, 0.8, tracer, Telemetry.noop(), clock);
        processor = new CaseProcessor(new RuleEngine(), evaluator, thresholds, Telemetry.noop());
        recorder = new RegressionRecorder(suite, clock);
    }

    @Override
    public void close() {
        executor.close();
    }
}
