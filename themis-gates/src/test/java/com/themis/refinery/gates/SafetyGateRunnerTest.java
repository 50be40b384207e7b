package com.themis.refinery.gates;

import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.GateType;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleType;
import com.themis.refinery.core.engine.DefaultRules;
import com.themis.refinery.core.engine.RuleEngine;
import com.themis.refinery.gates.unit.UnitGate;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SafetyGateRunnerTest {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");

    @Mock
    private SafetyGate regression;
    @Mock
    private SafetyGate holdout;
    @Mock
    private SafetyGate performance;
    @Mock
    private Telemetry telemetry;

    private RuleEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RuleEngine();
        when(regression.type()).thenReturn(GateType.REGRESSION);
        when(holdout.type()).thenReturn(GateType.HOLDOUT);
        when(performance.type()).thenReturn(GateType.PERFORMANCE);
        when(regression.evaluate(anyList())).thenReturn(GateResult.passed(GateType.REGRESSION, 1.0, Map.of()));
        when(holdout.evaluate(anyList())).thenReturn(GateResult.passed(GateType.HOLDOUT, 0.95, Map.of()));
        when(performance.evaluate(anyList())).thenReturn(GateResult.passed(GateType.PERFORMANCE, 1.0, Map.of()));
    }

    @Test
    void runsGatesInFixedOrderRegardlessOfRegistration() {
        SafetyGateRunner runner = new SafetyGateRunner(
                List.of(performance, holdout, new UnitGate(engine), regression), tracer, telemetry);

        GateReport report = runner.runAll("v1.0.1", DefaultRules.bootstrap());

        assertThat(report.results()).extracting(GateResult::gateType)
                .containsExactly(GateType.UNIT, GateType.REGRESSION, GateType.HOLDOUT, GateType.PERFORMANCE);
        assertThat(report.allPassed()).isTrue();
        assertThat(report.firstFailure()).isEmpty();
        verify(telemetry, never()).recordAlert(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("A rule set failing the unit fixtures stops after the unit gate")
    void shortCircuitsOnFirstFailure() {
        SafetyGateRunner runner = new SafetyGateRunner(
                List.of(new UnitGate(engine), regression, holdout, performance), tracer, telemetry);

        GateReport report = runner.runAll("v1.0.2", List.of());

        assertThat(report.results()).hasSize(1);
        assertThat(report.results().get(0).gateType()).isEqualTo(GateType.UNIT);
        assertThat(report.allPassed()).isFalse();
        verify(regression, never()).evaluate(anyList());
        verify(holdout, never()).evaluate(anyList());
        verify(performance, never()).evaluate(anyList());
        verify(telemetry).recordAlert(eq("safety_gate:unit"), eq(AlertSeverity.WARNING), anyString());
    }

    @Test
    void gateExceptionBecomesFailedResult() {
        when(holdout.evaluate(anyList())).thenThrow(new IllegalStateException("evaluator unreachable"));
        SafetyGateRunner runner = new SafetyGateRunner(List.of(regression, holdout, performance), tracer, telemetry);

        GateReport report = runner.runAll("v1.0.3", DefaultRules.bootstrap());

        assertThat(report.results()).extracting(GateResult::gateType)
                .containsExactly(GateType.REGRESSION, GateType.HOLDOUT);
        GateResult failed = report.firstFailure().orElseThrow();
        assertThat(failed.passed()).isFalse();
        assertThat(failed.error()).isEqualTo("evaluator unreachable");
        assertThat(failed.details()).containsEntry("error", "evaluator unreachable");
        verify(performance, never()).evaluate(anyList());
    }

    @Test
    void candidateRulesArePassedThrough() {
        List<Rule> candidate = List.of(Rule.of("only", RuleType.NOISE_REMOVAL,
                "x", "", 1, ""));
        SafetyGateRunner runner = new SafetyGateRunner(List.of(regression), tracer, telemetry);

        runner.runAll("v1.0.4", candidate);

        verify(regression).evaluate(candidate);
    }
}
