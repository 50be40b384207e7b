/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.evaluation;

import com.themis.refinery.api.Evaluator;
import com.themis.refinery.api.exception.EvaluatorException;
import com.themis.refinery.api.model.EvaluationOutcome;

import java.io.IOException;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluator backed by an external service. Transport and parsing failures
 * degrade to fallback metrics.
 */
public final class RemoteEvaluator implements Evaluator {
    private static final Logger logger = Logger.getLogger(RemoteEvaluator.class.getName());

    private final EvaluationTransport transport;
    private final EvaluationResponseParser parser;

    public RemoteEvaluator(EvaluationTransport transport) {
        this(transport, new EvaluationResponseParser());
    }

    public RemoteEvaluator(EvaluationTransport transport, EvaluationResponseParser parser) {
        this.transport = transport;
        this.parser = parser;
    }

    @Override
    public EvaluationOutcome evaluate(String beforeText, String afterText, Map<String, Object> metadata) {
        String response;
        try {
            response = transport.send(beforeText, afterText, metadata);
        } catch (IOException | RuntimeException e) {
            EvaluatorException failure = new EvaluatorException(
                    "Evaluator request failed for " + metadata.getOrDefault("case_id", "unknown case"), e);
            logger.log(Level.WARNING, failure.getMessage(), failure);
            return EvaluationOutcome.fallback("evaluator request failed: " + e.getMessage());
        }
        return parser.parse(response);
    }
}
