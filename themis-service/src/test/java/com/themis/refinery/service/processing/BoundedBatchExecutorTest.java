package com.themis.refinery.service.processing;

import com.themis.refinery.api.model.ApplyStats;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.ErrorKind;
import com.themis.refinery.api.model.QualityMetrics;
import com.themis.refinery.service.Documents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedBatchExecutorTest {

    private final BoundedBatchExecutor executor = new BoundedBatchExecutor(3, "test-batch");

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private static CaseEvaluation passed(DocumentCase document) {
        return new CaseEvaluation(document, document.content(), ApplyStats.unchanged(document.content().length()),
                QualityMetrics.zero(), List.of(), List.of(), 1, true, null, null);
    }

    @Test
    @DisplayName("Never runs more tasks at once than the limit")
    void concurrencyIsBounded() throws InterruptedException {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<DocumentCase> documents = Documents.corpus(30, 0);

        executor.processAll(documents, document -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return passed(document);
        });

        assertThat(peak.get()).isBetween(1, 3);
    }

    @Test
    void resultsFollowInputOrder() throws InterruptedException {
        List<DocumentCase> documents = Documents.corpus(20, 0);

        List<CaseEvaluation> results = executor.processAll(documents, document -> {
            if (document.caseId().endsWith("0")) {
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return passed(document);
        });

        assertThat(results).extracting(CaseEvaluation::caseId)
                .containsExactlyElementsOf(documents.stream().map(DocumentCase::caseId).toList());
    }

    @Test
    @DisplayName("A throwing task becomes a failed case and the batch continues")
    void taskExceptionsBecomeFailedCases() throws InterruptedException {
        List<DocumentCase> documents = Documents.corpus(5, 0);

        List<CaseEvaluation> results = executor.processAll(documents, document -> {
            if (document.caseId().equals("case-0002")) {
                throw new IllegalStateException("boom");
            }
            return passed(document);
        });

        assertThat(results).hasSize(5);
        assertThat(results.get(2).isFailed()).isTrue();
        assertThat(results.get(2).failureKind()).isEqualTo(ErrorKind.CASE_PROCESSING);
        assertThat(results.get(2).failure()).contains("boom");
        assertThat(results).filteredOn(CaseEvaluation::isFailed).hasSize(1);
    }

    @Test
    @DisplayName("Interrupting the caller cancels the tasks already submitted")
    void interruptCancelsSubmittedTasks() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(3);
        CountDownLatch interrupted = new CountDownLatch(3);
        CountDownLatch never = new CountDownLatch(1);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                executor.processAll(Documents.corpus(10, 0), document -> {
                    started.countDown();
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        Thread.currentThread().interrupt();
                    }
                    return passed(document);
                });
            } catch (InterruptedException e) {
                thrown.set(e);
            }
        }, "batch-caller");
        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        caller.interrupt();
        caller.join(5_000);

        assertThat(caller.isAlive()).isFalse();
        assertThat(thrown.get()).isInstanceOf(InterruptedException.class);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void nonPositiveLimitIsRejected() {
        assertThatThrownBy(() -> new BoundedBatchExecutor(0, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
