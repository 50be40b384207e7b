package com.themis.refinery.service.processing;

import com.themis.refinery.api.model.ApplyStats;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.ErrorKind;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.gates.QualityThresholds;
import com.themis.refinery.service.Documents;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BatchSummaryTest {

    private static final QualityMetrics GOOD = new QualityMetrics(0.96, 0.99, 0.94, 30.0, 0);
    private static final QualityMetrics POOR = new QualityMetrics(0.80, 0.99, 0.94, 10.0, 1);

    private static CaseEvaluation evaluated(String caseId, QualityMetrics metrics, long latency) {
        DocumentCase document = Documents.clean(caseId, "고등법원", "민사", 2020);
        return new CaseEvaluation(document, "주문 원고의 청구를 기각한다.", ApplyStats.unchanged(10), metrics,
                List.of(), List.of(), latency, QualityThresholds.defaults().accepts(metrics), null, null);
    }

    private final List<CaseEvaluation> batch = List.of(
            evaluated("c1", GOOD, 100),
            evaluated("c2", POOR, 200),
            CaseEvaluation.failed(Documents.clean("c3", "지방법원", "형사", 2021), ErrorKind.EVALUATOR,
                    "evaluator timed out after 60000 ms", 300));

    @Test
    void averagesCoverProcessedCasesOnly() {
        BatchSummary summary = BatchSummary.of(batch);

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.qualityPassed()).isEqualTo(1);
        assertThat(summary.average().nrr()).isCloseTo(0.88, within(1e-9));
        assertThat(summary.average().parsingErrors()).isEqualTo(1);
        assertThat(summary.avgLatencyMs()).isCloseTo(200.0, within(1e-9));
        assertThat(summary.failureRate()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(summary.tokensAfter()).isLessThan(summary.tokensBefore());
    }

    @Test
    void aggregationIgnoresCompletionOrder() {
        List<CaseEvaluation> shuffled = new ArrayList<>(batch);
        Collections.reverse(shuffled);

        assertThat(BatchSummary.of(shuffled)).isEqualTo(BatchSummary.of(batch));
    }

    @Test
    void failedCasesWeighQualityScoreDown() {
        BatchSummary summary = BatchSummary.of(batch);

        assertThat(summary.qualityScore())
                .isCloseTo(summary.average().compositeScore() * 2 / 3, within(1e-9));
        assertThat(summary.meets(QualityThresholds.defaults())).isFalse();
    }

    @Test
    void emptyBatch() {
        BatchSummary summary = BatchSummary.of(List.of());

        assertThat(summary.failureRate()).isZero();
        assertThat(summary.qualityScore()).isZero();
        assertThat(summary.meets(QualityThresholds.defaults())).isFalse();
    }

    @Test
    void tokenEstimateIsWordsTimesOnePointThree() {
        assertThat(TokenEstimator.estimate("원고의 청구를 기각한다 끝")).isEqualTo(5L);
        assertThat(TokenEstimator.estimate("")).isZero();
    }
}
