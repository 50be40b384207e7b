package com.themis.refinery.service.evaluation;

import com.themis.refinery.api.Evaluator;
import com.themis.refinery.api.model.EvaluationOutcome;
import com.themis.refinery.api.model.QualityMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeLimitedEvaluatorTest {

    private static final QualityMetrics METRICS = new QualityMetrics(0.95, 0.99, 0.95, 30.0, 0);

    @Test
    void passesThroughTimelyResults() {
        Evaluator delegate = (before, after, metadata) -> EvaluationOutcome.of(METRICS, List.of(), List.of());
        try (TimeLimitedEvaluator evaluator = new TimeLimitedEvaluator(delegate, Duration.ofSeconds(5))) {
            EvaluationOutcome outcome = evaluator.evaluate("전", "후", Map.of("case_id", "c-1"));

            assertThat(outcome.degraded()).isFalse();
            assertThat(outcome.metrics()).isEqualTo(METRICS);
        }
    }

    @Test
    void slowCallsFallBackAfterTimeout() {
        CountDownLatch never = new CountDownLatch(1);
        Evaluator delegate = (before, after, metadata) -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return EvaluationOutcome.of(METRICS, List.of(), List.of());
        };
        try (TimeLimitedEvaluator evaluator = new TimeLimitedEvaluator(delegate, Duration.ofMillis(100))) {
            EvaluationOutcome outcome = evaluator.evaluate("전", "후", Map.of("case_id", "c-1"));

            assertThat(outcome.degraded()).isTrue();
            assertThat(outcome.metrics()).isEqualTo(QualityMetrics.zero());
            assertThat(outcome.errors()).containsExactly("evaluator timed out after 100 ms");
        }
    }

    @Test
    void delegateExceptionsFallBack() {
        Evaluator delegate = (before, after, metadata) -> {
            throw new IllegalStateException("connection reset");
        };
        try (TimeLimitedEvaluator evaluator = new TimeLimitedEvaluator(delegate)) {
            EvaluationOutcome outcome = evaluator.evaluate("전", "후", Map.of());

            assertThat(outcome.degraded()).isTrue();
            assertThat(outcome.errors()).containsExactly("evaluator failed: connection reset");
        }
    }

    @Test
    void zeroTimeoutIsRejected() {
        assertThatThrownBy(() -> new TimeLimitedEvaluator((b, a, m) -> null, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
