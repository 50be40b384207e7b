package com.themis.refinery.core.telemetry;

import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.core.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsTelemetryTest {

    private final InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
    private final MetricsTelemetry telemetry = new MetricsTelemetry(metrics);

    @Test
    void casesAreCountedBySuccess() {
        telemetry.recordCaseProcessed(120, true);
        telemetry.recordCaseProcessed(80, true);
        telemetry.recordCaseProcessed(3000, false);

        assertThat(metrics.getCounterValue("themis_cases_processed", "success", "true")).isEqualTo(2);
        assertThat(metrics.getCounterValue("themis_cases_processed", "success", "false")).isEqualTo(1);
        assertThat(metrics.getTimerRecordings("themis_case_latency"))
                .containsExactly(Duration.ofMillis(120), Duration.ofMillis(80), Duration.ofMillis(3000));
    }

    @Test
    void alertsAreCountedBySeverity() {
        telemetry.recordAlert("safety_gate", AlertSeverity.WARNING, "unit gate failed for v1.0.3");
        telemetry.recordAlert("persistence", AlertSeverity.CRITICAL, "save failed");

        assertThat(metrics.getCounterValue("themis_alerts", "severity", "WARNING")).isEqualTo(1);
        assertThat(metrics.getCounterValue("themis_alerts", "severity", "CRITICAL")).isEqualTo(1);
    }

    @Test
    void tracingIsNoopUnlessEnabled() {
        assertThat(TracingService.getInstance().getTracer()).isNotNull();
    }
}
