package com.themis.refinery.gates.performance;

import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.core.engine.DefaultRules;
import com.themis.refinery.core.engine.RuleEngine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PerformanceGateTest {

    private final RuleEngine engine = new RuleEngine();

    @Test
    void bootstrapRulesStayWithinDefaultLimits() {
        GateResult result = new PerformanceGate(engine).evaluate(DefaultRules.bootstrap());

        assertThat(result.passed()).isTrue();
        assertThat(result.score()).isBetween(0.0, 1.0);
        assertThat(result.details()).containsKeys("elapsed_ms", "allocated_mb");
    }

    @Test
    void failsWhenMemoryLimitIsExceeded() {
        GateResult result = new PerformanceGate(engine, 5_000, 1e-9).evaluate(DefaultRules.bootstrap());

        assertThat(result.passed()).isFalse();
        assertThat(result.score()).isLessThan(1.0);
    }

    @Test
    void syntheticInputIsLarge() {
        assertThat(PerformanceGate.SYNTHETIC_INPUT).hasSize("테스트 내용 ".length() * 1000);
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> new PerformanceGate(engine, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
