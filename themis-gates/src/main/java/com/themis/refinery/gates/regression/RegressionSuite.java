package com.themis.refinery.gates.regression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Most recent regression cases, oldest evicted first. Recording a case id
 * that is already present replaces it. Thread-safe.
 */
public final class RegressionSuite {
    private static final Logger logger = Logger.getLogger(RegressionSuite.class.getName());

    public static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final Deque<RegressionCase> cases = new ArrayDeque<>();

    public RegressionSuite() {
        this(DEFAULT_CAPACITY);
    }

    public RegressionSuite(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized void record(RegressionCase regressionCase) {
        cases.removeIf(existing -> existing.caseId().equals(regressionCase.caseId()));
        cases.addLast(regressionCase);
        while (cases.size() > capacity) {
            RegressionCase evicted = cases.pollFirst();
            logger.fine("Evicted regression case " + evicted.caseId());
        }
    }

    public synchronized List<RegressionCase> cases() {
        return List.copyOf(cases);
    }

    public synchronized int size() {
        return cases.size();
    }

    public synchronized boolean isEmpty() {
        return cases.isEmpty();
    }

    public int capacity() {
        return capacity;
    }
}
