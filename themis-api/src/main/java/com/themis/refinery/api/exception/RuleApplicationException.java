/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.exception;

/**
 * Thrown when a single rule cannot be applied to a text. Callers isolate it: the rule counts as not applied and the remaining rules still run.
 */
public class RuleApplicationException extends RuntimeException {

    public RuleApplicationException(String message) {
        super(message);
    }

    public RuleApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
