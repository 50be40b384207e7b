/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.processing;

import com.themis.refinery.api.Evaluator;
import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.model.ApplyResult;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.ErrorKind;
import com.themis.refinery.api.model.EvaluationOutcome;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.core.engine.RuleEngine;
import com.themis.refinery.gates.QualityThresholds;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transforms one document with a pinned rule list and has the result
 * evaluated. Never throws: any failure becomes a failed {@link CaseEvaluation}.
 */
public final class CaseProcessor {
    private static final Logger logger = Logger.getLogger(CaseProcessor.class.getName());

    private final RuleEngine engine;
    private final Evaluator evaluator;
    private final QualityThresholds thresholds;
    private final Telemetry telemetry;

    public CaseProcessor(RuleEngine engine, Evaluator evaluator, QualityThresholds thresholds, Telemetry telemetry) {
        this.engine = engine;
        this.evaluator = evaluator;
        this.thresholds = thresholds;
        this.telemetry = telemetry;
    }

    public CaseEvaluation process(DocumentCase document, List<Rule> rules) {
        long start = System.nanoTime();
        try {
            ApplyResult result = engine.applyRules(document.content(), rules);
            EvaluationOutcome outcome = evaluator.evaluate(document.content(), result.text(), metadataOf(document));
            long latencyMs = elapsedMillis(start);

            CaseEvaluation evaluation;
            if (outcome.degraded()) {
                String message = outcome.errors().isEmpty() ? "evaluator degraded" : outcome.errors().get(0);
                evaluation = new CaseEvaluation(document, result.text(), result.stats(), outcome.metrics(),
                        outcome.errors(), List.of(), latencyMs, false, message, ErrorKind.EVALUATOR);
            } else {
                evaluation = new CaseEvaluation(document, result.text(), result.stats(), outcome.metrics(),
                        outcome.errors(), outcome.suggestions(), latencyMs,
                        thresholds.accepts(outcome.metrics()), null, null);
            }
            telemetry.recordCaseProcessed(latencyMs, !evaluation.isFailed());
            return evaluation;
        } catch (RuntimeException e) {
            long latencyMs = elapsedMillis(start);
            logger.log(Level.WARNING, "Processing failed for case " + document.caseId(), e);
            telemetry.recordCaseProcessed(latencyMs, false);
            return CaseEvaluation.failed(document, ErrorKind.CASE_PROCESSING,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), latencyMs);
        }
    }

    public QualityThresholds thresholds() {
        return thresholds;
    }

    public RuleEngine engine() {
        return engine;
    }

    static Map<String, Object> metadataOf(DocumentCase document) {
        return Map.of(
                "case_id", document.caseId(),
                "court_type", document.courtType(),
                "case_type", document.caseType(),
                "year", document.year(),
                "format_type", document.formatType());
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
