/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

/**
 * Processing job lifecycle.
 *
 * <pre>
 * PENDING → SAMPLING → PROCESSING → ANALYZING → COMPLETED
 * any non-terminal → CANCELLED (stop) | FAILED (persistence/version error)
 * PROCESSING ⇄ PAUSED
 * </pre>
 */
public enum JobStatus {
    PENDING,
    SAMPLING,
    PROCESSING,
    ANALYZING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
