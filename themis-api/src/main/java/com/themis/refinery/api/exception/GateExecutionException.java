/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.exception;

/**
 * Thrown when a safety gate cannot complete. The gate is reported as failed.
 */
public class GateExecutionException extends RuntimeException {

    public GateExecutionException(String message) {
        super(message);
    }

    public GateExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
