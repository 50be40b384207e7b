package com.themis.refinery.gates.holdout;

import com.themis.refinery.api.Evaluator;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.EvaluationOutcome;
import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.GateType;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.core.engine.RuleEngine;
import com.themis.refinery.gates.MetricAverages;
import com.themis.refinery.gates.QualityThresholds;
import com.themis.refinery.gates.SafetyGate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Processes a holdout sample with the candidate rules and checks the
 * averaged evaluator metrics against the quality thresholds.
 */
public final class HoldoutGate implements SafetyGate {
    private static final Logger logger = Logger.getLogger(HoldoutGate.class.getName());

    private final RuleEngine engine;
    private final Evaluator evaluator;
    private final Supplier<List<DocumentCase>> holdoutSample;
    private final QualityThresholds thresholds;

    public HoldoutGate(RuleEngine engine, Evaluator evaluator, Supplier<List<DocumentCase>> holdoutSample,
                       QualityThresholds thresholds) {
        this.engine = engine;
        this.evaluator = evaluator;
        this.holdoutSample = holdoutSample;
        this.thresholds = thresholds;
    }

    @Override
    public GateType type() {
        return GateType.HOLDOUT;
    }

    @Override
    public GateResult evaluate(List<Rule> candidateRules) {
        List<DocumentCase> sample = holdoutSample.get();
        if (sample.isEmpty()) {
            return GateResult.passed(type(), 1.0, Map.of("message", "Holdout sample is empty"));
        }

        List<QualityMetrics> collected = new ArrayList<>(sample.size());
        int degraded = 0;
        for (DocumentCase document : sample) {
            String after = engine.applyRules(document.content(), candidateRules).text();
            EvaluationOutcome outcome = evaluator.evaluate(document.content(), after, Map.of(
                    "case_id", document.caseId(),
                    "court_type", document.courtType(),
                    "case_type", document.caseType(),
                    "year", document.year()));
            if (outcome.degraded()) {
                degraded++;
            }
            collected.add(outcome.metrics());
        }

        QualityMetrics average = MetricAverages.of(collected);
        List<String> violations = thresholds.violations(average);
        logger.info(String.format("Holdout on %d documents: nrr=%.3f fpr=%.3f ss=%.3f tokens=%.1f%%",
                sample.size(), average.nrr(), average.fprOrIcr(), average.ss(), average.tokenReduction()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sample_size", sample.size());
        details.put("degraded_evaluations", degraded);
        details.put("metrics", average);
        details.put("violations", violations);
        return violations.isEmpty()
                ? GateResult.passed(type(), average.compositeScore(), details)
                : GateResult.failed(type(), average.compositeScore(), details);
    }
}
