package com.themis.refinery.gates;

import com.themis.refinery.api.model.QualityMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityThresholdsTest {

    private final QualityThresholds thresholds = QualityThresholds.defaults();

    @Test
    void acceptsMetricsAtTheMinimums() {
        assertThat(thresholds.accepts(new QualityMetrics(0.92, 0.985, 0.90, 20.0, 0))).isTrue();
    }

    @Test
    void listsEveryViolation() {
        List<String> violations = thresholds.violations(new QualityMetrics(0.5, 0.99, 0.5, 10.0, 0));

        assertThat(violations).hasSize(3);
        assertThat(violations).anyMatch(v -> v.startsWith("nrr"))
                .anyMatch(v -> v.startsWith("ss"))
                .anyMatch(v -> v.startsWith("token_reduction"));
    }

    @Test
    void averagesAreFieldWise() {
        QualityMetrics average = MetricAverages.of(List.of(
                new QualityMetrics(0.9, 1.0, 0.8, 10.0, 1),
                new QualityMetrics(1.0, 0.98, 1.0, 30.0, 2)));

        assertThat(average.nrr()).isEqualTo(0.95, within(1e-9));
        assertThat(average.tokenReduction()).isEqualTo(20.0, within(1e-9));
        assertThat(average.parsingErrors()).isEqualTo(3);
        assertThat(MetricAverages.of(List.of())).isEqualTo(QualityMetrics.zero());
    }
}
