package com.themis.refinery.gates;

import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.exception.GateExecutionException;
import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.Rule;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the safety gates in fixed order (unit, regression, holdout,
 * performance) and stops at the first failure.
 */
public final class SafetyGateRunner {
    private static final Logger logger = Logger.getLogger(SafetyGateRunner.class.getName());

    private final List<SafetyGate> gates;
    private final Tracer tracer;
    private final Telemetry telemetry;

    public SafetyGateRunner(List<SafetyGate> gates, Tracer tracer, Telemetry telemetry) {
        List<SafetyGate> ordered = new ArrayList<>(gates);
        ordered.sort(Comparator.comparingInt(gate -> gate.type().ordinal()));
        this.gates = List.copyOf(ordered);
        this.tracer = tracer;
        this.telemetry = telemetry;
    }

    public GateReport runAll(String candidateVersion, List<Rule> candidateRules) {
        Span span = tracer.spanBuilder("safety-gates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("candidateVersion", candidateVersion);
            span.setAttribute("ruleCount", candidateRules.size());

            List<GateResult> results = new ArrayList<>();
            for (SafetyGate gate : gates) {
                GateResult result = runGate(gate, candidateRules);
                results.add(result);
                logger.info(String.format("Gate %s for %s: %s (score %.3f)", gate.type().code(),
                        candidateVersion, result.passed() ? "PASSED" : "FAILED", result.score()));
                if (!result.passed()) {
                    span.setStatus(StatusCode.ERROR, "gate " + gate.type().code() + " failed");
                    telemetry.recordAlert("safety_gate:" + gate.type().code(), AlertSeverity.WARNING,
                            "Candidate " + candidateVersion + " failed the " + gate.type().code() + " gate");
                    break;
                }
            }

            GateReport report = new GateReport(candidateVersion, results);
            span.setAttribute("allPassed", report.allPassed());
            return report;
        } finally {
            span.end();
        }
    }

    public List<SafetyGate> gates() {
        return gates;
    }

    private GateResult runGate(SafetyGate gate, List<Rule> candidateRules) {
        try {
            return gate.evaluate(candidateRules);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            GateExecutionException failure = new GateExecutionException(
                    "Gate " + gate.type().code() + " threw: " + message, e);
            logger.log(Level.WARNING, failure.getMessage(), failure);
            return GateResult.errored(gate.type(), message);
        }
    }
}
