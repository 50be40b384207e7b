package com.themis.refinery.gates.regression;

import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleType;
import com.themis.refinery.core.engine.DefaultRules;
import com.themis.refinery.core.engine.RuleEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegressionGateTest {

    private final RuleEngine engine = new RuleEngine();
    private RegressionSuite suite;
    private RegressionGate gate;

    @BeforeEach
    void setUp() {
        suite = new RegressionSuite();
        gate = new RegressionGate(engine, suite);
    }

    private static RegressionCase pageNumberCase(String id) {
        return new RegressionCase(id, "page number left in output",
                "판결 이유 페이지 3 원고의 청구를 기각한다", "(?:페이지|page)[ \\t]*\\d+",
                List.of("원고의 청구를 기각한다"), Instant.parse("2025-03-01T09:00:00Z"));
    }

    @Test
    void emptySuitePasses() {
        GateResult result = gate.evaluate(List.of());

        assertThat(result.passed()).isTrue();
        assertThat(result.score()).isEqualTo(1.0);
        assertThat(result.details()).containsEntry("message", "No regression cases recorded");
    }

    @Test
    void fixedCaseDoesNotReproduce() {
        suite.record(pageNumberCase("case-1"));

        assertThat(gate.evaluate(DefaultRules.bootstrap()).passed()).isTrue();
    }

    @Test
    void residualNoiseReproduces() {
        suite.record(pageNumberCase("case-1"));

        GateResult result = gate.evaluate(List.of());

        assertThat(result.passed()).isFalse();
        assertThat(result.details().get("reproduced")).asList().containsExactly("case-1");
    }

    @Test
    void losingProtectedTextReproduces() {
        suite.record(pageNumberCase("case-1"));
        List<Rule> overeager = List.of(Rule.of("drop_all", RuleType.NOISE_REMOVAL, "페이지.*", "", 100, ""));

        assertThat(gate.evaluate(overeager).passed()).isFalse();
    }

    @Test
    void suiteKeepsTheMostRecentCases() {
        for (int i = 1; i <= 12; i++) {
            suite.record(pageNumberCase("case-" + i));
        }
        suite.record(pageNumberCase("case-5"));

        assertThat(suite.size()).isEqualTo(RegressionSuite.DEFAULT_CAPACITY);
        assertThat(suite.cases()).extracting(RegressionCase::caseId)
                .doesNotContain("case-1", "case-2")
                .endsWith("case-5")
                .containsOnlyOnce("case-5");
    }

    @Test
    void invalidResidualPatternIsRejected() {
        assertThatThrownBy(() -> new RegressionCase("bad", "", "text", "(", List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
