package com.themis.refinery.service.runner;

import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.gates.regression.RegressionCase;
import com.themis.refinery.gates.regression.RegressionGate;
import com.themis.refinery.service.FootnoteEvaluator;
import com.themis.refinery.service.processing.BatchSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ReadinessCheckTest {

    private RunnerFixture fixture;
    private Optional<BatchSummary> latestBatch;
    private ReadinessCheck check;

    @BeforeEach
    void setUp() throws PersistenceException {
        fixture = new RunnerFixture(new FootnoteEvaluator(), List.of());
        latestBatch = Optional.of(summary(FootnoteEvaluator.GOOD));
        check = new ReadinessCheck(() -> latestBatch, fixture.thresholds,
                new RegressionGate(fixture.gateEngine, fixture.suite), fixture.store, Duration.ofHours(1),
                fixture.clock);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void initialRuleSetWithPassingBatchIsReady() {
        ReadinessVerdict verdict = check.evaluate();

        assertThat(verdict.ready()).isTrue();
        assertThat(verdict.reasons()).isEmpty();
    }

    @Test
    void batchBelowThresholdsIsNotReady() {
        latestBatch = Optional.of(summary(FootnoteEvaluator.POOR));

        assertThat(check.evaluate().reasons())
                .containsExactly("latest batch below quality thresholds: nrr 0.800 < 0.920, token_reduction 10.0 < 20.0");
    }

    @Test
    void reproducedRegressionIsNotReady() {
        fixture.suite.record(new RegressionCase("case-0007:footnote", "각주 번호 잔존", "본문 각주 3 끝",
                FootnoteEvaluator.FOOTNOTE_PATTERN, List.of(), fixture.clock.instant()));

        assertThat(check.evaluate().reasons())
                .containsExactly("live rules reproduce recorded regressions: [case-0007:footnote]");
    }

    @Test
    void recentPromotionMustSettleForTheStabilityWindow() throws PersistenceException {
        fixture.store.replaceAll(fixture.store.rules(), "v1.0.1", "promotion", Map.of());

        assertThat(check.evaluate().reasons())
                .containsExactly("rule set v1.0.1 promoted less than 60 minutes ago");

        fixture.clock.advance(Duration.ofMinutes(61));
        assertThat(check.evaluate().ready()).isTrue();
    }

    private static BatchSummary summary(QualityMetrics average) {
        return new BatchSummary(12, 0, 12, average, 5.0, 180, 150);
    }
}
