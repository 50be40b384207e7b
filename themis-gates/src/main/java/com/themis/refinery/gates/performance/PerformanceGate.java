package com.themis.refinery.gates.performance;

import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.GateType;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.core.engine.RuleEngine;
import com.themis.refinery.gates.SafetyGate;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Times the candidate rules on a large synthetic document and measures the
 * memory allocated by the processing thread.
 */
public final class PerformanceGate implements SafetyGate {

    public static final long DEFAULT_MAX_MILLIS = 5_000;
    public static final double DEFAULT_MAX_MEGABYTES = 1_000.0;

    static final String SYNTHETIC_INPUT = "테스트 내용 ".repeat(1000);

    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    private final RuleEngine engine;
    private final long maxMillis;
    private final double maxMegabytes;

    public PerformanceGate(RuleEngine engine) {
        this(engine, DEFAULT_MAX_MILLIS, DEFAULT_MAX_MEGABYTES);
    }

    public PerformanceGate(RuleEngine engine, long maxMillis, double maxMegabytes) {
        if (maxMillis <= 0 || maxMegabytes <= 0) {
            throw new IllegalArgumentException("Performance limits must be positive");
        }
        this.engine = engine;
        this.maxMillis = maxMillis;
        this.maxMegabytes = maxMegabytes;
    }

    @Override
    public GateType type() {
        return GateType.PERFORMANCE;
    }

    @Override
    public GateResult evaluate(List<Rule> candidateRules) {
        long allocatedBefore = allocatedBytes();
        long start = System.nanoTime();
        String output = engine.applyRules(SYNTHETIC_INPUT, candidateRules).text();
        double elapsedMillis = (System.nanoTime() - start) / 1_000_000.0;
        long allocatedAfter = allocatedBytes();

        double megabytes = allocatedBefore >= 0 && allocatedAfter >= allocatedBefore
                ? (allocatedAfter - allocatedBefore) / BYTES_PER_MEGABYTE
                : estimateMegabytes(output);

        double score = Math.min(1.0, Math.min(maxMillis / elapsedMillis, maxMegabytes / megabytes));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("elapsed_ms", elapsedMillis);
        details.put("allocated_mb", megabytes);
        details.put("max_ms", maxMillis);
        details.put("max_mb", maxMegabytes);
        return elapsedMillis <= maxMillis && megabytes <= maxMegabytes
                ? GateResult.passed(type(), score, details)
                : GateResult.failed(type(), score, details);
    }

    /**
     * Bytes allocated so far by the current thread, or -1 when the JVM
     * cannot report it.
     */
    private static long allocatedBytes() {
        ThreadMXBean threads = ManagementFactory.getThreadMXBean();
        if (threads instanceof com.sun.management.ThreadMXBean sunThreads
                && sunThreads.isThreadAllocatedMemorySupported()
                && sunThreads.isThreadAllocatedMemoryEnabled()) {
            return sunThreads.getThreadAllocatedBytes(Thread.currentThread().getId());
        }
        return -1;
    }

    // input and output as UTF-16
    private static double estimateMegabytes(String output) {
        return (SYNTHETIC_INPUT.length() + output.length()) * 2 / BYTES_PER_MEGABYTE;
    }
}
