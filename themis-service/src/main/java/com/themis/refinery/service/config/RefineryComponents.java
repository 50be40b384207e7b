/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.config;

import com.themis.refinery.api.CorpusSource;
import com.themis.refinery.api.Evaluator;
import com.themis.refinery.api.RulePersistence;
import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.RuleType;
import com.themis.refinery.api.model.StratificationCriteria;
import com.themis.refinery.core.engine.DefaultRules;
import com.themis.refinery.core.engine.RuleEngine;
import com.themis.refinery.core.persistence.InMemoryRulePersistence;
import com.themis.refinery.core.persistence.JsonFileRulePersistence;
import com.themis.refinery.core.store.RuleStore;
import com.themis.refinery.core.telemetry.MetricsTelemetry;
import com.themis.refinery.core.telemetry.TracingService;
import com.themis.refinery.core.version.VersionManager;
import com.themis.refinery.evolution.AutoRollbackPolicy;
import com.themis.refinery.evolution.OscillationGuard;
import com.themis.refinery.evolution.PatchSynthesizer;
import com.themis.refinery.evolution.patch.PatchHistory;
import com.themis.refinery.gates.QualityThresholds;
import com.themis.refinery.gates.SafetyGate;
import com.themis.refinery.gates.SafetyGateRunner;
import com.themis.refinery.gates.holdout.HoldoutGate;
import com.themis.refinery.gates.performance.PerformanceGate;
import com.themis.refinery.gates.regression.RegressionGate;
import com.themis.refinery.gates.regression.RegressionSuite;
import com.themis.refinery.gates.unit.UnitGate;
import com.themis.refinery.service.Orchestrator;
import com.themis.refinery.service.checkpoint.CheckpointStore;
import com.themis.refinery.service.checkpoint.InMemoryCheckpointStore;
import com.themis.refinery.service.checkpoint.JsonFileCheckpointStore;
import com.themis.refinery.service.corpus.FailureClusterer;
import com.themis.refinery.service.evaluation.TimeLimitedEvaluator;
import com.themis.refinery.service.processing.BoundedBatchExecutor;
import com.themis.refinery.service.processing.CaseProcessor;
import com.themis.refinery.service.processing.ProcessedCaseSink;
import com.themis.refinery.service.runner.CostModel;
import com.themis.refinery.service.runner.DryRunCriteria;
import com.themis.refinery.service.runner.EvolutionCycle;
import com.themis.refinery.service.runner.FullCorpusRunner;
import com.themis.refinery.service.runner.ReadinessCheck;
import com.themis.refinery.service.runner.RegressionRecorder;
import com.themis.refinery.service.runner.SingleCaseRunner;
import com.themis.refinery.service.runner.StratifiedBatchRunner;
import io.opentelemetry.api.trace.Tracer;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Wires the refinery from settings and the three outside collaborators:
 * the corpus, the evaluator and the sink for processed documents.
 *
 * <p>With a data directory configured, rule versions and checkpoints are
 * kept as JSON files under it; otherwise everything stays in memory.
 */
public final class RefineryComponents implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RefineryComponents.class.getName());

    private final RulePersistence persistence;
    private final RuleStore ruleStore;
    private final VersionManager versionManager;
    private final OscillationGuard oscillationGuard;
    private final PatchHistory patchHistory;
    private final RegressionSuite regressionSuite;
    private final SafetyGateRunner gateRunner;
    private final TimeLimitedEvaluator evaluator;
    private final BoundedBatchExecutor batchExecutor;
    private final BoundedBatchExecutor fullExecutor;
    private final Orchestrator orchestrator;

    private RefineryComponents(RefinerySettings settings, CorpusSource corpus, Evaluator remoteEvaluator,
                               ProcessedCaseSink sink, Clock clock, Telemetry telemetry, Tracer tracer)
            throws PersistenceException {
        this.persistence = rulePersistence(settings);
        this.ruleStore = new RuleStore(persistence, DefaultRules.bootstrap(), clock);
        ruleStore.loadLatest();
        this.versionManager = new VersionManager(ruleStore.version(), clock);
        this.oscillationGuard = new OscillationGuard(settings.oscillationWindow(), settings.oscillationCooldown(),
                clock, telemetry);
        this.patchHistory = new PatchHistory();
        this.regressionSuite = new RegressionSuite();
        this.evaluator = new TimeLimitedEvaluator(remoteEvaluator, settings.evaluatorTimeout());

        Set<RuleType> disabled = settings.factExtractionEnabled()
                ? EnumSet.noneOf(RuleType.class)
                : EnumSet.of(RuleType.FACT_EXTRACTION);
        RuleEngine processingEngine = new RuleEngine(disabled);
        // gate runs keep their own usage counter
        RuleEngine gateEngine = new RuleEngine(disabled);

        QualityThresholds thresholds = QualityThresholds.defaults();
        Supplier<List<DocumentCase>> holdoutSample = () -> settings.holdoutSize() == 0
                ? List.of()
                : corpus.stratifiedSample(StratificationCriteria.defaults(), settings.holdoutSize());
        List<SafetyGate> gates = List.of(
                new UnitGate(gateEngine),
                new RegressionGate(gateEngine, regressionSuite),
                new HoldoutGate(gateEngine, evaluator, holdoutSample, thresholds),
                new PerformanceGate(gateEngine));
        this.gateRunner = new SafetyGateRunner(gates, tracer, telemetry);

        EvolutionCycle cycle = new EvolutionCycle(ruleStore,
                new PatchSynthesizer(ruleStore, settings.synthesisThreshold(), clock),
                oscillationGuard, patchHistory, versionManager, gateRunner, settings.autoApplyThreshold(),
                tracer, telemetry, clock);
        CaseProcessor processor = new CaseProcessor(processingEngine, evaluator, thresholds, telemetry);
        RegressionRecorder recorder = new RegressionRecorder(regressionSuite, clock);

        this.batchExecutor = new BoundedBatchExecutor(settings.batchConcurrency(), "themis-batch");
        this.fullExecutor = new BoundedBatchExecutor(settings.fullConcurrency(), "themis-full");

        SingleCaseRunner singleCaseRunner = new SingleCaseRunner(corpus, processor, ruleStore, cycle, recorder,
                settings.readinessPasses());
        StratifiedBatchRunner batchRunner = new StratifiedBatchRunner(corpus, processor, ruleStore, persistence,
                cycle, new FailureClusterer(thresholds), recorder, new AutoRollbackPolicy(), batchExecutor,
                settings.batchSampleCap(), settings.stabilizationCycles());
        CheckpointStore checkpoints = checkpointStore(settings);
        ReadinessCheck readiness = new ReadinessCheck(batchRunner::latestSummary, thresholds,
                new RegressionGate(gateEngine, regressionSuite), ruleStore, settings.stabilityWindow(), clock);
        FullCorpusRunner fullRunner = new FullCorpusRunner(corpus, processor, ruleStore, checkpoints, sink,
                readiness, DryRunCriteria.withBudget(settings.costBudget()), CostModel.defaults(), fullExecutor,
                settings, tracer, clock);

        this.orchestrator = new Orchestrator(singleCaseRunner, batchRunner, fullRunner, cycle, persistence,
                checkpoints, settings, telemetry, clock);
        logger.info(String.format("Refinery ready: rules %s (%d rules), %s storage",
                ruleStore.version(), ruleStore.rules().size(),
                settings.dataDirectory().map(Path::toString).orElse("in-memory")));
    }

    /**
     * Components with metrics-backed telemetry and the process-wide tracer.
     */
    public static RefineryComponents create(RefinerySettings settings, CorpusSource corpus, Evaluator evaluator,
                                            ProcessedCaseSink sink) throws PersistenceException {
        return create(settings, corpus, evaluator, sink, Clock.systemUTC(), new MetricsTelemetry(),
                TracingService.getInstance().getTracer());
    }

    public static RefineryComponents create(RefinerySettings settings, CorpusSource corpus, Evaluator evaluator,
                                            ProcessedCaseSink sink, Clock clock, Telemetry telemetry,
                                            Tracer tracer) throws PersistenceException {
        return new RefineryComponents(settings, corpus, evaluator, sink, clock, telemetry, tracer);
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public RuleStore ruleStore() {
        return ruleStore;
    }

    public RulePersistence persistence() {
        return persistence;
    }

    public VersionManager versionManager() {
        return versionManager;
    }

    public OscillationGuard oscillationGuard() {
        return oscillationGuard;
    }

    public PatchHistory patchHistory() {
        return patchHistory;
    }

    public RegressionSuite regressionSuite() {
        return regressionSuite;
    }

    public SafetyGateRunner gateRunner() {
        return gateRunner;
    }

    @Override
    public void close() {
        orchestrator.close();
        batchExecutor.close();
        fullExecutor.close();
        evaluator.close();
    }

    private static RulePersistence rulePersistence(RefinerySettings settings) {
        return settings.dataDirectory()
                .<RulePersistence>map(directory -> new JsonFileRulePersistence(directory.resolve("rules")))
                .orElseGet(InMemoryRulePersistence::new);
    }

    private static CheckpointStore checkpointStore(RefinerySettings settings) {
        return settings.dataDirectory()
                .<CheckpointStore>map(JsonFileCheckpointStore::new)
                .orElseGet(InMemoryCheckpointStore::new);
    }
}
