/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

/**
 * Failure classes surfaced to operators through job status.
 */
public enum ErrorKind {
    RULE_APPLICATION,
    PATCH_SYNTHESIS,
    GATE_EXECUTION,
    EVALUATOR,
    PERSISTENCE,
    CASE_PROCESSING
}
