package com.themis.refinery.gates.unit;

import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.GateType;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.core.engine.RuleEngine;
import com.themis.refinery.gates.SafetyGate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs fixed input/expected fixtures through the candidate rules. Outputs
 * match exactly or after whitespace normalization.
 */
public final class UnitGate implements SafetyGate {

    public static final double DEFAULT_PASS_FRACTION = 0.9;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RuleEngine engine;
    private final List<UnitFixture> fixtures;
    private final double passFraction;

    public UnitGate(RuleEngine engine) {
        this(engine, UnitFixture.defaults(), DEFAULT_PASS_FRACTION);
    }

    public UnitGate(RuleEngine engine, List<UnitFixture> fixtures, double passFraction) {
        this.engine = engine;
        this.fixtures = List.copyOf(fixtures);
        this.passFraction = passFraction;
    }

    @Override
    public GateType type() {
        return GateType.UNIT;
    }

    @Override
    public GateResult evaluate(List<Rule> candidateRules) {
        if (fixtures.isEmpty()) {
            return GateResult.passed(type(), 1.0, Map.of("message", "No unit fixtures configured"));
        }

        List<String> mismatched = new ArrayList<>();
        for (UnitFixture fixture : fixtures) {
            String actual = engine.applyRules(fixture.input(), candidateRules).text();
            if (!matches(actual, fixture.expected())) {
                mismatched.add(fixture.name());
            }
        }

        int passedCount = fixtures.size() - mismatched.size();
        double score = (double) passedCount / fixtures.size();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total", fixtures.size());
        details.put("passed", passedCount);
        details.put("mismatched", mismatched);
        return score >= passFraction
                ? GateResult.passed(type(), score, details)
                : GateResult.failed(type(), score, details);
    }

    static boolean matches(String actual, String expected) {
        return actual.equals(expected) || normalize(actual).equals(normalize(expected));
    }

    private static String normalize(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
