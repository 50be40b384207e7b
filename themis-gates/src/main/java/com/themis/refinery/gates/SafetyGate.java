package com.themis.refinery.gates;

import com.themis.refinery.api.model.GateResult;
import com.themis.refinery.api.model.GateType;
import com.themis.refinery.api.model.Rule;

import java.util.List;

/**
 * One validation stage for a candidate rule set.
 *
 * <p>Implementations evaluate the rule list they are given and must not
 * read or mutate the live rule store. Throwing is allowed; the runner
 * turns exceptions into a failed result.
 */
public interface SafetyGate {

    GateType type();

    GateResult evaluate(List<Rule> candidateRules);
}
