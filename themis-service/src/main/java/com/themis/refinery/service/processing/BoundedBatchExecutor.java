/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.processing;

import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs per-document tasks with at most {@code maxConcurrent} in flight and
 * waits for all of them. Results come back in input order.
 */
public final class BoundedBatchExecutor implements AutoCloseable {

    private final int maxConcurrent;
    private final ExecutorService executor;

    public BoundedBatchExecutor(int maxConcurrent, String name) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
        this.maxConcurrent = maxConcurrent;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(maxConcurrent, runnable -> {
            Thread thread = new Thread(runnable, name + "-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @throws InterruptedException when the calling thread is interrupted; every
     *                              task already submitted is cancelled first
     */
    public List<CaseEvaluation> processAll(List<DocumentCase> documents,
                                           Function<DocumentCase, CaseEvaluation> task)
            throws InterruptedException {
        Semaphore permits = new Semaphore(maxConcurrent);
        List<Future<CaseEvaluation>> futures = new ArrayList<>(documents.size());
        try {
            for (DocumentCase document : documents) {
                permits.acquire();
                futures.add(executor.submit(() -> evaluate(document, task, permits)));
            }

            List<CaseEvaluation> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), documents.get(i)));
            }
            return results;
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        }
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static CaseEvaluation evaluate(DocumentCase document, Function<DocumentCase, CaseEvaluation> task,
                                           Semaphore permits) {
        try {
            return task.apply(document);
        } catch (RuntimeException e) {
            return CaseEvaluation.failed(document, ErrorKind.CASE_PROCESSING, String.valueOf(e.getMessage()), 0);
        } finally {
            permits.release();
        }
    }

    private static CaseEvaluation await(Future<CaseEvaluation> future, DocumentCase document)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return CaseEvaluation.failed(document, ErrorKind.CASE_PROCESSING, String.valueOf(e.getCause()), 0);
        }
    }
}
