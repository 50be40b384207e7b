package com.themis.refinery.gates.regression;

import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.GateType;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.core.engine.RuleEngine;
import com.themis.refinery.gates.SafetyGate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RegressionGate implements SafetyGate {

    private final RuleEngine engine;
    private final RegressionSuite suite;

    public RegressionGate(RuleEngine engine, RegressionSuite suite) {
        this.engine = engine;
        this.suite = suite;
    }

    @Override
    public GateType type() {
        return GateType.REGRESSION;
    }

    /**
     * Passes only when no recorded case reproduces under the given rules.
     */
    @Override
    public GateResult evaluate(List<Rule> candidateRules) {
        List<RegressionCase> cases = suite.cases();
        if (cases.isEmpty()) {
            return GateResult.passed(type(), 1.0, Map.of("message", "No regression cases recorded"));
        }

        List<String> reproduced = new ArrayList<>();
        for (RegressionCase regressionCase : cases) {
            String output = engine.applyRules(regressionCase.input(), candidateRules).text();
            if (regressionCase.reproducesIn(output)) {
                reproduced.add(regressionCase.caseId());
            }
        }

        double score = 1.0 - (double) reproduced.size() / cases.size();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total", cases.size());
        details.put("reproduced", reproduced);
        return reproduced.isEmpty()
                ? GateResult.passed(type(), score, details)
                : GateResult.failed(type(), score, details);
    }
}
