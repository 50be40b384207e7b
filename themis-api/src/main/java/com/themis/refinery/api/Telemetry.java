/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api;

import com.themis.refinery.api.model.AlertSeverity;

/**
 * Observability hooks. Implementations must be side-effect free with
 * respect to processing: a missing or failing telemetry backend never
 * changes results.
 */
public interface Telemetry {

    void recordCaseProcessed(long timeMs, boolean success);

    void recordAlert(String ruleName, AlertSeverity severity, String message);

    static Telemetry noop() {
        return NoOpTelemetry.INSTANCE;
    }
}
