/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.exception;

/**
 * Thrown when an evaluator suggestion is malformed. The suggestion is skipped.
 */
public class PatchSynthesisException extends RuntimeException {

    public PatchSynthesisException(String message) {
        super(message);
    }

    public PatchSynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
