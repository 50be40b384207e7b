/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api;

import com.themis.refinery.api.model.EvaluationOutcome;

import java.util.Map;

/**
 * External quality evaluator.
 *
 * <p>Implementations must not throw for bad upstream answers: they return
 * {@link EvaluationOutcome#fallback(String)} instead, so one broken response
 * never aborts a batch.
 */
@FunctionalInterface
public interface Evaluator {

    /**
     * Scores a before/after pair.
     *
     * @param beforeText original document text
     * @param afterText  text after rule application
     * @param metadata   case attributes (case id, court type, ...)
     * @return metrics, reported errors and rule suggestions
     */
    EvaluationOutcome evaluate(String beforeText, String afterText, Map<String, Object> metadata);
}
