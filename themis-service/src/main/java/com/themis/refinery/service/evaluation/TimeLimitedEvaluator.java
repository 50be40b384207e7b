/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.evaluation;

import com.themis.refinery.api.Evaluator;
import com.themis.refinery.api.exception.EvaluatorException;
import com.themis.refinery.api.model.EvaluationOutcome;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounds every call to a delegate evaluator. A call that times out, throws
 * or is interrupted returns fallback metrics with one error.
 */
public final class TimeLimitedEvaluator implements Evaluator, AutoCloseable {
    private static final Logger logger = Logger.getLogger(TimeLimitedEvaluator.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final Evaluator delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeLimitedEvaluator(Evaluator delegate) {
        this(delegate, DEFAULT_TIMEOUT);
    }

    public TimeLimitedEvaluator(Evaluator delegate, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.delegate = delegate;
        this.timeout = timeout;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "evaluator-call-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public EvaluationOutcome evaluate(String beforeText, String afterText, Map<String, Object> metadata) {
        Future<EvaluationOutcome> call = executor.submit(() -> delegate.evaluate(beforeText, afterText, metadata));
        try {
            EvaluationOutcome outcome = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return outcome != null ? outcome : EvaluationOutcome.fallback("evaluator returned no result");
        } catch (TimeoutException e) {
            call.cancel(true);
            logger.warning(String.format("Evaluator timed out after %d ms for %s",
                    timeout.toMillis(), metadata.getOrDefault("case_id", "unknown case")));
            return EvaluationOutcome.fallback("evaluator timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            EvaluatorException failure = new EvaluatorException("Evaluator failed: " + cause.getMessage(), cause);
            logger.log(Level.WARNING, failure.getMessage(), failure);
            return EvaluationOutcome.fallback("evaluator failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return EvaluationOutcome.fallback("evaluator call interrupted");
        }
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
