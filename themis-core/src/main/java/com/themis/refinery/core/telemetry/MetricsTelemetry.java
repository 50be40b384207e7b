package com.themis.refinery.core.telemetry;

import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.core.metrics.MetricsRegistry;

import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Telemetry} on top of the metrics registry. Alerts are also logged,
 * at a level matching their severity.
 */
public final class MetricsTelemetry implements Telemetry {
    private static final Logger logger = Logger.getLogger(MetricsTelemetry.class.getName());

    private final MetricsRegistry metrics;

    public MetricsTelemetry() {
        this(MetricsRegistry.getInstance());
    }

    public MetricsTelemetry(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public void recordCaseProcessed(long timeMs, boolean success) {
        metrics.counter("themis_cases_processed", "success", String.valueOf(success)).increment();
        metrics.timer("themis_case_latency").record(Duration.ofMillis(Math.max(0, timeMs)));
    }

    @Override
    public void recordAlert(String ruleName, AlertSeverity severity, String message) {
        metrics.counter("themis_alerts", "severity", severity.name()).increment();
        Level level = switch (severity) {
            case INFO -> Level.INFO;
            case WARNING -> Level.WARNING;
            case CRITICAL -> Level.SEVERE;
        };
        logger.log(level, String.format("[%s] %s: %s", severity, ruleName, message));
    }
}
