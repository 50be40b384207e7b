/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api;

import com.themis.refinery.api.model.AlertSeverity;

final class NoOpTelemetry implements Telemetry {

    static final NoOpTelemetry INSTANCE = new NoOpTelemetry();

    private NoOpTelemetry() {
    }

    @Override
    public void recordCaseProcessed(long timeMs, boolean success) {
        // no-op
    }

    @Override
    public void recordAlert(String ruleName, AlertSeverity severity, String message) {
        // no-op
    }
}
