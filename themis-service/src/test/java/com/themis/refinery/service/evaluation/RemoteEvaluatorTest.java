package com.themis.refinery.service.evaluation;

import com.themis.refinery.api.model.EvaluationOutcome;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteEvaluatorTest {

    @Test
    void parsesTransportResponse() {
        RemoteEvaluator evaluator = new RemoteEvaluator((before, after, metadata) ->
                "{\"metrics\": {\"nrr\": 0.93, \"icr\": 0.99, \"ss\": 0.92, \"token_reduction\": 21}}");

        EvaluationOutcome outcome = evaluator.evaluate("전", "후", Map.of());

        assertThat(outcome.degraded()).isFalse();
        assertThat(outcome.metrics().nrr()).isEqualTo(0.93);
    }

    @Test
    void transportFailureDegrades() {
        RemoteEvaluator evaluator = new RemoteEvaluator((before, after, metadata) -> {
            throw new IOException("503 Service Unavailable");
        });

        EvaluationOutcome outcome = evaluator.evaluate("전", "후", Map.of());

        assertThat(outcome.degraded()).isTrue();
        assertThat(outcome.errors()).singleElement().asString().contains("503 Service Unavailable");
    }
}
