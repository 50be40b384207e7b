package com.themis.refinery.service.runner;

import com.themis.refinery.api.Evaluator;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.JobStatus;
import com.themis.refinery.api.model.ProcessingScale;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.api.model.StratificationCriteria;
import com.themis.refinery.evolution.AutoRollbackPolicy;
import com.themis.refinery.service.Documents;
import com.themis.refinery.service.FootnoteEvaluator;
import com.themis.refinery.service.corpus.FailureClusterer;
import com.themis.refinery.service.corpus.InMemoryCorpusSource;
import com.themis.refinery.service.job.JobOptions;
import com.themis.refinery.service.job.ProcessingJob;
import com.themis.refinery.service.processing.BatchSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StratifiedBatchRunnerTest {

    private static final QualityMetrics GOOD = FootnoteEvaluator.GOOD;
    private static final QualityMetrics POOR = FootnoteEvaluator.POOR;

    private RunnerFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    private StratifiedBatchRunner runner(Evaluator evaluator, List<DocumentCase> corpus) throws PersistenceException {
        fixture = new RunnerFixture(evaluator, corpus.subList(0, 4));
        return new StratifiedBatchRunner(new InMemoryCorpusSource(corpus), fixture.processor, fixture.store,
                fixture.persistence, fixture.cycle, new FailureClusterer(fixture.thresholds), fixture.recorder,
                new AutoRollbackPolicy(), fixture.executor, 20, 3);
    }

    private ProcessingJob job() {
        return new ProcessingJob("batch-1", ProcessingScale.BATCH, JobOptions.defaults(), fixture.clock, 20);
    }

    @Test
    @DisplayName("A promoted cycle is re-validated on the same sample and scales the next sample up")
    void promotesRevalidatesAndScalesUp() throws Exception {
        StratifiedBatchRunner runner = runner(new FootnoteEvaluator(), Documents.corpus(30, 1));
        ProcessingJob job = job();

        BatchCycleReport report = runner.run(job, 12, StratificationCriteria.defaults());

        assertThat(report.sampleSize()).isEqualTo(12);
        assertThat(report.cycle().outcome()).isEqualTo(CycleResult.Outcome.PROMOTED);
        assertThat(report.activeVersion()).isEqualTo("v1.0.1");
        assertThat(report.before().average().nrr()).isCloseTo(POOR.nrr(), within(1e-9));
        assertThat(report.after().average().nrr()).isCloseTo(GOOD.nrr(), within(1e-9));
        assertThat(report.qualityGain()).isCloseTo(0.05, within(1e-9));
        assertThat(report.rolledBack()).isFalse();
        assertThat(report.nextAction()).isEqualTo(NextAction.SCALE_UP);
        assertThat(report.nextSampleSize()).isEqualTo(20);

        assertThat(job.status()).isEqualTo(JobStatus.ANALYZING);
        assertThat(job.snapshot().processedCases()).isEqualTo(24);
        assertThat(runner.latestSummary()).contains(report.after());
        assertThat(fixture.store.rules())
                .anyMatch(rule -> rule.pattern().equals(FootnoteEvaluator.FOOTNOTE_PATTERN) && rule.usageCount() > 0);
    }

    @Test
    void cleanSampleHasNothingToEvolve() throws Exception {
        StratifiedBatchRunner runner = runner(new FootnoteEvaluator(), Documents.corpus(30, 0));

        BatchCycleReport report = runner.run(job(), 12, StratificationCriteria.defaults());

        assertThat(report.cycle().outcome()).isEqualTo(CycleResult.Outcome.NO_SUGGESTIONS);
        assertThat(report.after()).isSameAs(report.before());
        assertThat(report.clusters()).isEmpty();
        assertThat(report.nextAction()).isEqualTo(NextAction.RETRY_SAME_SCALE);
        assertThat(report.nextSampleSize()).isEqualTo(12);
        assertThat(fixture.store.version()).isEqualTo("v1.0.0");
    }

    @Test
    @DisplayName("A stop request takes effect at the next phase boundary")
    void stopRequestedDuringProcessingCancelsBeforeAnalysis() throws Exception {
        ProcessingJob[] holder = new ProcessingJob[1];
        FootnoteEvaluator footnotes = new FootnoteEvaluator();
        Evaluator stopping = (before, after, metadata) -> {
            holder[0].requestStop();
            return footnotes.evaluate(before, after, metadata);
        };
        StratifiedBatchRunner runner = runner(stopping, Documents.corpus(30, 1));
        holder[0] = job();

        assertThatThrownBy(() -> runner.run(holder[0], 12, StratificationCriteria.defaults()))
                .isInstanceOf(CancellationException.class);
        assertThat(holder[0].snapshot().processedCases()).isEqualTo(12);
        assertThat(fixture.store.version()).isEqualTo("v1.0.0");
    }

    @Test
    @DisplayName("Three cycles without significant gain stabilize the batch scale")
    void decideTracksNonSignificantCycles() throws PersistenceException {
        StratifiedBatchRunner runner = runner(new FootnoteEvaluator(), Documents.corpus(6, 0));
        BatchSummary poor = summary(0, POOR);
        BatchSummary good = summary(0, GOOD);

        assertThat(runner.decide(good, good, true)).isEqualTo(NextAction.RETRY_SAME_SCALE);
        assertThat(runner.decide(good, good, true)).isEqualTo(NextAction.RETRY_SAME_SCALE);
        assertThat(runner.decide(poor, good, true)).isEqualTo(NextAction.SCALE_UP);
        assertThat(runner.decide(good, good, true)).isEqualTo(NextAction.RETRY_SAME_SCALE);
        assertThat(runner.decide(good, good, true)).isEqualTo(NextAction.RETRY_SAME_SCALE);
        assertThat(runner.decide(good, good, true)).isEqualTo(NextAction.STABILIZED);
    }

    @Test
    void improvementCountsOnlyWhenTheVersionIsKept() throws PersistenceException {
        StratifiedBatchRunner runner = runner(new FootnoteEvaluator(), Documents.corpus(6, 0));
        BatchSummary failing = summary(2, GOOD);
        BatchSummary recovered = summary(0, GOOD);

        assertThat(runner.decide(failing, recovered, false)).isEqualTo(NextAction.RETRY_SAME_SCALE);
        assertThat(runner.decide(failing, recovered, true)).isEqualTo(NextAction.SCALE_UP);
    }

    @Test
    void diversityCountsDistinctCourtsCaseTypesAndYears() {
        assertThat(StratifiedBatchRunner.diversityScore(Documents.corpus(45, 0))).isCloseTo(11 / 15.0, within(1e-9));
        assertThat(StratifiedBatchRunner.diversityScore(List.of(Documents.clean("a", "고등법원", "민사", 2020))))
                .isCloseTo(3 / 15.0, within(1e-9));
        assertThat(StratifiedBatchRunner.diversityScore(List.of())).isZero();
    }

    private static BatchSummary summary(int failed, QualityMetrics average) {
        return new BatchSummary(10, failed, 10 - failed, average, 100.0, 1_000, 800);
    }
}
