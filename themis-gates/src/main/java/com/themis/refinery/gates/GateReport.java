package com.themis.refinery.gates;

import com.themis.refinery.api.model.GateResult;

import java.util.List;
import java.util.Optional;

/**
 * Results of the gates that actually ran, in execution order.
 */
public record GateReport(String candidateVersion, List<GateResult> results) {

    public GateReport {
        results = List.copyOf(results);
    }

    public boolean allPassed() {
        return results.stream().allMatch(GateResult::passed);
    }

    public Optional<GateResult> firstFailure() {
        return results.stream().filter(result -> !result.passed()).findFirst();
    }
}
