/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.themis.refinery.api.model.EvaluationOutcome;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.api.model.RawSuggestion;
import com.themis.refinery.core.persistence.JsonMappers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Extracts the evaluation JSON from a free-form evaluator answer.
 *
 * <p>The payload is taken from a fenced {@code json} block when present,
 * otherwise from the first opening to the last closing brace. Metrics accept
 * either {@code icr} or {@code fpr}. Anything unreadable yields zero metrics
 * and a single error instead of an exception.
 */
public final class EvaluationResponseParser {
    private static final Logger logger = Logger.getLogger(EvaluationResponseParser.class.getName());

    private static final String FENCE_OPEN = "```json";
    private static final String FENCE_CLOSE = "```";

    private final ObjectMapper mapper;

    public EvaluationResponseParser() {
        this(JsonMappers.create());
    }

    public EvaluationResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public EvaluationOutcome parse(String response) {
        Optional<String> payload = extractJson(response);
        if (payload.isEmpty()) {
            return degrade("no JSON object in evaluator response");
        }

        JsonNode root;
        try {
            root = mapper.readTree(payload.get());
        } catch (JsonProcessingException e) {
            return degrade("malformed evaluator JSON: " + e.getOriginalMessage());
        }

        JsonNode metricsNode = root.path("metrics");
        if (!metricsNode.isObject()) {
            return degrade("evaluator response has no metrics object");
        }
        JsonNode fidelity = metricsNode.has("icr") ? metricsNode.get("icr") : metricsNode.get("fpr");
        if (!isNumber(metricsNode.get("nrr")) || !isNumber(fidelity) || !isNumber(metricsNode.get("ss"))) {
            return degrade("evaluator metrics incomplete: " + metricsNode);
        }

        QualityMetrics metrics = new QualityMetrics(
                metricsNode.get("nrr").asDouble(),
                fidelity.asDouble(),
                metricsNode.get("ss").asDouble(),
                metricsNode.path("token_reduction").asDouble(0.0),
                metricsNode.path("parsing_errors").asInt(0));

        List<String> errors = new ArrayList<>();
        for (JsonNode error : root.path("errors")) {
            errors.add(error.isTextual() ? error.asText() : error.toString());
        }

        List<RawSuggestion> suggestions = new ArrayList<>();
        for (JsonNode suggestion : root.path("suggestions")) {
            try {
                suggestions.add(mapper.treeToValue(suggestion, RawSuggestion.class));
            } catch (JsonProcessingException e) {
                logger.warning("Skipping unreadable suggestion: " + e.getOriginalMessage());
            }
        }
        return EvaluationOutcome.of(metrics, errors, suggestions);
    }

    static Optional<String> extractJson(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        int fence = response.indexOf(FENCE_OPEN);
        if (fence >= 0) {
            int start = fence + FENCE_OPEN.length();
            int end = response.indexOf(FENCE_CLOSE, start);
            if (end > start) {
                return Optional.of(response.substring(start, end).trim());
            }
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(response.substring(start, end + 1));
    }

    private static boolean isNumber(JsonNode node) {
        return node != null && node.isNumber();
    }

    private static EvaluationOutcome degrade(String error) {
        logger.warning(error);
        return EvaluationOutcome.fallback(error);
    }
}
