package com.themis.refinery.evolution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Decides whether a promoted version performs badly enough against its
 * predecessor to be rolled back.
 */
public final class AutoRollbackPolicy {
    private static final Logger logger = Logger.getLogger(AutoRollbackPolicy.class.getName());

    public static final double DEFAULT_DEGRADATION_FACTOR = 0.95;
    public static final double DEFAULT_ERROR_GROWTH_FACTOR = 1.5;

    private final double degradationFactor;
    private final double errorGrowthFactor;

    public AutoRollbackPolicy() {
        this(DEFAULT_DEGRADATION_FACTOR, DEFAULT_ERROR_GROWTH_FACTOR);
    }

    public AutoRollbackPolicy(double degradationFactor, double errorGrowthFactor) {
        if (degradationFactor <= 0.0 || degradationFactor > 1.0) {
            throw new IllegalArgumentException("Degradation factor must be in (0.0, 1.0]");
        }
        if (errorGrowthFactor < 1.0) {
            throw new IllegalArgumentException("Error growth factor must be at least 1.0");
        }
        this.degradationFactor = degradationFactor;
        this.errorGrowthFactor = errorGrowthFactor;
    }

    public RollbackDecision evaluate(VersionPerformance current, VersionPerformance previous) {
        List<String> reasons = new ArrayList<>();
        degraded("nrr", current.nrr(), previous.nrr(), reasons);
        degraded("fpr", current.fpr(), previous.fpr(), reasons);
        degraded("ss", current.ss(), previous.ss(), reasons);
        if (current.errorRate() > previous.errorRate() * errorGrowthFactor) {
            reasons.add(String.format("error rate %.4f exceeds %.1fx previous %.4f",
                    current.errorRate(), errorGrowthFactor, previous.errorRate()));
        }

        if (!reasons.isEmpty()) {
            logger.warning("Rollback recommended: " + String.join("; ", reasons));
        }
        return new RollbackDecision(!reasons.isEmpty(), reasons);
    }

    private void degraded(String metric, double current, double previous, List<String> reasons) {
        if (current < previous * degradationFactor) {
            reasons.add(String.format("%s %.4f below %.2f of previous %.4f",
                    metric, current, degradationFactor, previous));
        }
    }

    /**
     * Aggregate metrics of one rule-set version.
     */
    public record VersionPerformance(double nrr, double fpr, double ss, double errorRate) {

        public static final String NRR = "nrr";
        public static final String FPR = "fpr";
        public static final String SS = "ss";
        public static final String ERROR_RATE = "error_rate";

        /**
         * Reads a version's performance snapshot; missing keys count as zero.
         */
        public static VersionPerformance fromSnapshot(Map<String, Double> snapshot) {
            return new VersionPerformance(
                    snapshot.getOrDefault(NRR, 0.0),
                    snapshot.getOrDefault(FPR, 0.0),
                    snapshot.getOrDefault(SS, 0.0),
                    snapshot.getOrDefault(ERROR_RATE, 0.0));
        }

        public Map<String, Double> toSnapshot() {
            return Map.of(NRR, nrr, FPR, fpr, SS, ss, ERROR_RATE, errorRate);
        }
    }

    public record RollbackDecision(boolean rollback, List<String> reasons) {

        public RollbackDecision {
            reasons = List.copyOf(reasons);
        }
    }
}
