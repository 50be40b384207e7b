/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.processing;

import com.themis.refinery.api.model.ApplyStats;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.ErrorKind;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.api.model.RawSuggestion;

import java.util.List;

/**
 * Outcome of transforming and evaluating one document.
 *
 * @param failure     case-level error message, {@code null} when the case was processed
 * @param failureKind kind of the case-level error, {@code null} when the case was processed
 */
public record CaseEvaluation(
    DocumentCase document,
    String output,
    ApplyStats stats,
    QualityMetrics metrics,
    List<String> errors,
    List<RawSuggestion> suggestions,
    long latencyMs,
    boolean meetsQuality,
    String failure,
    ErrorKind failureKind
) {

    public CaseEvaluation {
        errors = errors == null ? List.of() : List.copyOf(errors);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static CaseEvaluation failed(DocumentCase document, ErrorKind kind, String message, long latencyMs) {
        return new CaseEvaluation(document, document.content(), ApplyStats.unchanged(document.content().length()),
                QualityMetrics.zero(), List.of(message), List.of(), latencyMs, false, message, kind);
    }

    public String caseId() {
        return document.caseId();
    }

    /**
     * True when the case could not be processed; counted in failed cases.
     */
    public boolean isFailed() {
        return failure != null;
    }

    /**
     * True when the evaluator reported problems or quality fell short.
     */
    public boolean hasProblems() {
        return isFailed() || !meetsQuality || !errors.isEmpty();
    }
}
