package com.themis.refinery.gates;

import com.themis.refinery.api.model.QualityMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimum acceptable quality for processed documents.
 *
 * @param minTokenReduction minimum token reduction, in percent
 */
public record QualityThresholds(double minNrr, double minFpr, double minSs, double minTokenReduction) {

    private static final QualityThresholds DEFAULTS = new QualityThresholds(0.92, 0.985, 0.90, 20.0);

    public static QualityThresholds defaults() {
        return DEFAULTS;
    }

    public boolean accepts(QualityMetrics metrics) {
        return violations(metrics).isEmpty();
    }

    public List<String> violations(QualityMetrics metrics) {
        List<String> violations = new ArrayList<>();
        if (metrics.nrr() < minNrr) {
            violations.add(String.format("nrr %.3f < %.3f", metrics.nrr(), minNrr));
        }
        if (metrics.fprOrIcr() < minFpr) {
            violations.add(String.format("fpr %.3f < %.3f", metrics.fprOrIcr(), minFpr));
        }
        if (metrics.ss() < minSs) {
            violations.add(String.format("ss %.3f < %.3f", metrics.ss(), minSs));
        }
        if (metrics.tokenReduction() < minTokenReduction) {
            violations.add(String.format("token_reduction %.1f < %.1f", metrics.tokenReduction(), minTokenReduction));
        }
        return violations;
    }
}
