/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.exception;

/**
 * Thrown when the evaluator call times out or answers with something unusable. The case degrades to fallback metrics.
 */
public class EvaluatorException extends RuntimeException {

    public EvaluatorException(String message) {
        super(message);
    }

    public EvaluatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
