package com.themis.refinery.core.engine;

import com.themis.refinery.api.exception.RuleApplicationException;
import com.themis.refinery.api.model.AppliedRule;
import com.themis.refinery.api.model.ApplyResult;
import com.themis.refinery.api.model.ApplyStats;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleType;
import com.themis.refinery.core.metrics.Counter;
import com.themis.refinery.core.metrics.MetricsRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Applies an ordered rule set to a text.
 *
 * <p>Enabled rules run by descending priority, ties broken by rule id, each
 * rule receiving the previous rule's output. The engine holds no mutable
 * state that influences output, so a fixed {@code (text, rules)} pair always
 * yields the same result. Thread-safe.
 */
public final class RuleEngine {
    private static final Logger logger = Logger.getLogger(RuleEngine.class.getName());

    static final Comparator<Rule> APPLICATION_ORDER =
            Comparator.comparingInt(Rule::priority).reversed().thenComparing(Rule::ruleId);

    private final Set<RuleType> disabledTypes;
    private final PatternCache patternCache;
    private final RuleUsageCounter usageCounter;
    private final Counter applicationErrors;

    /**
     * Engine with {@code fact_extraction} switched off.
     */
    public RuleEngine() {
        this(EnumSet.of(RuleType.FACT_EXTRACTION));
    }

    public RuleEngine(Set<RuleType> disabledTypes) {
        this(disabledTypes, new PatternCache(), new RuleUsageCounter(), MetricsRegistry.getInstance());
    }

    public RuleEngine(Set<RuleType> disabledTypes, PatternCache patternCache,
                      RuleUsageCounter usageCounter, MetricsRegistry metrics) {
        this.disabledTypes = disabledTypes.isEmpty()
                ? EnumSet.noneOf(RuleType.class)
                : EnumSet.copyOf(disabledTypes);
        this.patternCache = patternCache;
        this.usageCounter = usageCounter;
        this.applicationErrors = metrics.counter("themis_rule_application_errors");
    }

    public ApplyResult applyRules(String text, Collection<Rule> rules) {
        return applyRules(text, rules, Set.of());
    }

    /**
     * @param typeFilter restricts the run to these types; empty means all types
     */
    public ApplyResult applyRules(String text, Collection<Rule> rules, Set<RuleType> typeFilter) {
        String current = text == null ? "" : text;
        int originalLength = current.length();

        List<Rule> ordered = selectRules(rules, typeFilter);
        List<AppliedRule> applied = new ArrayList<>();
        Map<RuleType, Integer> typeCounts = new EnumMap<>(RuleType.class);

        for (Rule rule : ordered) {
            int lengthBefore = current.length();
            Optional<TransformOutcome> outcome = applyRule(rule, current);
            if (outcome.isEmpty() || !outcome.get().applied()) {
                continue;
            }
            current = outcome.get().text();
            usageCounter.record(rule.ruleId());
            typeCounts.merge(rule.type(), 1, Integer::sum);
            applied.add(new AppliedRule(rule.ruleId(), rule.type(), rule.description(),
                    lengthBefore, current.length()));
        }

        double reductionRate = originalLength == 0
                ? 0.0
                : (double) (originalLength - current.length()) / originalLength;

        ApplyStats stats = new ApplyStats(originalLength, current.length(), applied.size(),
                typeCounts, applied, reductionRate);
        return new ApplyResult(current, stats);
    }

    /**
     * Applies one rule in isolation. Empty when the rule could not be applied;
     * the failure is logged and counted but never propagated.
     */
    public Optional<TransformOutcome> applyRule(Rule rule, String text) {
        int flags = TextTransforms.flagsFor(rule.type());
        Optional<Pattern> pattern = patternCache.get(rule.pattern(), flags);
        if (pattern.isEmpty()) {
            applicationErrors.increment();
            return Optional.empty();
        }
        try {
            return Optional.of(TextTransforms.forType(rule.type())
                    .apply(text, pattern.get(), rule.replacement()));
        } catch (RuntimeException e) {
            applicationErrors.increment();
            RuleApplicationException failure = new RuleApplicationException(
                    "Rule " + rule.ruleId() + " failed: " + e.getMessage(), e);
            logger.log(Level.WARNING, failure.getMessage(), failure);
            return Optional.empty();
        }
    }

    public boolean isTypeEnabled(RuleType type) {
        return !disabledTypes.contains(type);
    }

    public RuleUsageCounter usageCounter() {
        return usageCounter;
    }

    List<Rule> selectRules(Collection<Rule> rules, Set<RuleType> typeFilter) {
        return rules.stream()
                .filter(Rule::enabled)
                .filter(rule -> !disabledTypes.contains(rule.type()))
                .filter(rule -> typeFilter == null || typeFilter.isEmpty() || typeFilter.contains(rule.type()))
                .sorted(APPLICATION_ORDER)
                .toList();
    }
}
