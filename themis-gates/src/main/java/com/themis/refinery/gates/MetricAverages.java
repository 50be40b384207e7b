package com.themis.refinery.gates;

import com.themis.refinery.api.model.QualityMetrics;

import java.util.Collection;

public final class MetricAverages {

    private MetricAverages() {
    }

    /**
     * Field-wise mean; parsing errors are summed. Zero metrics for an empty input.
     */
    public static QualityMetrics of(Collection<QualityMetrics> metrics) {
        if (metrics.isEmpty()) {
            return QualityMetrics.zero();
        }
        double nrr = 0.0;
        double fpr = 0.0;
        double ss = 0.0;
        double tokenReduction = 0.0;
        int parsingErrors = 0;
        for (QualityMetrics m : metrics) {
            nrr += m.nrr();
            fpr += m.fprOrIcr();
            ss += m.ss();
            tokenReduction += m.tokenReduction();
            parsingErrors += m.parsingErrors();
        }
        int n = metrics.size();
        return new QualityMetrics(nrr / n, fpr / n, ss / n, tokenReduction / n, parsingErrors);
    }
}
