package com.themis.refinery.core.store;

import com.themis.refinery.api.RulePersistence;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleSetVersion;
import com.themis.refinery.core.engine.DefaultRules;
import com.themis.refinery.core.persistence.InMemoryRulePersistence;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Authoritative holder of the current rule set.
 *
 * <p>Readers get the current {@link RuleSetVersion} without locking; the
 * snapshot is immutable, so a batch that captured it at start keeps a
 * consistent view. Mutators are serialized and always persist the full
 * snapshot before swapping it in: if the save fails nothing changes and the
 * {@link PersistenceException} reaches the caller.
 */
public final class RuleStore {
    private static final Logger logger = Logger.getLogger(RuleStore.class.getName());

    public static final String INITIAL_VERSION = "v1.0.0";

    private static final Comparator<Rule> BY_ID = Comparator.comparing(Rule::ruleId);

    private final RulePersistence persistence;
    private final List<Rule> bootstrapRules;
    private final Clock clock;
    private final AtomicReference<RuleSetVersion> current;

    public RuleStore(RulePersistence persistence) {
        this(persistence, DefaultRules.bootstrap(), Clock.systemUTC());
    }

    public RuleStore(RulePersistence persistence, List<Rule> bootstrapRules, Clock clock) {
        this.persistence = persistence;
        this.bootstrapRules = List.copyOf(bootstrapRules);
        this.clock = clock;
        this.current = new AtomicReference<>(
                new RuleSetVersion("v0.0.0", List.of(), clock.instant(), false, Map.of(), null, "unloaded"));
    }

    /**
     * Loads the latest persisted snapshot, seeding the bootstrap rules as
     * {@value #INITIAL_VERSION} when nothing was persisted yet.
     */
    public synchronized RuleSetVersion loadLatest() throws PersistenceException {
        Optional<RuleSetVersion> latest = persistence.loadLatestVersion();
        RuleSetVersion loaded;
        if (latest.isPresent()) {
            loaded = latest.get();
            logger.info(String.format("Loaded rule set %s with %d rules",
                    loaded.version(), loaded.rules().size()));
        } else {
            loaded = new RuleSetVersion(INITIAL_VERSION, bootstrapRules, clock.instant(), true,
                    Map.of(), null, "bootstrap rule set");
            persistence.saveVersion(loaded);
            logger.info(String.format("No persisted rules found, seeded %d bootstrap rules as %s",
                    bootstrapRules.size(), INITIAL_VERSION));
        }
        current.set(loaded);
        return loaded;
    }

    public RuleSetVersion current() {
        return current.get();
    }

    public List<Rule> rules() {
        return current.get().rules();
    }

    public String version() {
        return current.get().version();
    }

    /**
     * Atomically replaces the whole rule set with a new version.
     */
    public synchronized RuleSetVersion replaceAll(List<Rule> rules, String version, String description,
                                                  Map<String, Double> performanceSnapshot)
            throws PersistenceException {
        RuleSetVersion previous = current.get();
        RuleSetVersion next = new RuleSetVersion(version, rules, clock.instant(), true,
                performanceSnapshot, previous.version(), description);
        persistence.saveVersion(next);
        current.set(next);
        logger.info(String.format("Rule set replaced: %s -> %s (%d rules)",
                previous.version(), version, rules.size()));
        return next;
    }

    /**
     * Makes an earlier snapshot current again exactly as it was saved,
     * parent version included.
     */
    public synchronized RuleSetVersion restore(RuleSetVersion snapshot) throws PersistenceException {
        RuleSetVersion previous = current.get();
        persistence.saveVersion(snapshot);
        current.set(snapshot);
        logger.info(String.format("Rule set restored: %s -> %s (%d rules)",
                previous.version(), snapshot.version(), snapshot.rules().size()));
        return snapshot;
    }

    /**
     * Inserts the rule, or replaces the rule with the same id, keeping the
     * current version label.
     */
    public synchronized Rule upsertOne(Rule rule) throws PersistenceException {
        mutate(rules -> {
            List<Rule> updated = new ArrayList<>(rules.size() + 1);
            boolean replaced = false;
            for (Rule existing : rules) {
                if (existing.ruleId().equals(rule.ruleId())) {
                    updated.add(rule);
                    replaced = true;
                } else {
                    updated.add(existing);
                }
            }
            if (!replaced) {
                updated.add(rule);
            }
            return updated;
        });
        return rule;
    }

    /**
     * Disables a rule without removing it.
     *
     * @return the disabled rule, or empty when no rule has this id
     */
    public synchronized Optional<Rule> disable(String ruleId) throws PersistenceException {
        Optional<Rule> existing = findById(ruleId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Rule disabled = existing.get().withEnabled(false, clock.instant());
        upsertOne(disabled);
        return Optional.of(disabled);
    }

    /**
     * Adds usage counts gathered by the engine to the stored rules.
     */
    public synchronized void absorbUsage(Map<String, Long> usage) throws PersistenceException {
        if (usage.isEmpty()) {
            return;
        }
        mutate(rules -> rules.stream()
                .map(rule -> {
                    Long delta = usage.get(rule.ruleId());
                    return delta == null ? rule : rule.withUsageCount(rule.usageCount() + delta);
                })
                .toList());
    }

    /**
     * Finds an enabled rule of the same type whose pattern is identical or
     * near-identical to the candidate's. A rule with the candidate's own id
     * is not a duplicate of it.
     */
    public Optional<Rule> findDuplicate(Rule candidate) {
        return rules().stream()
                .filter(Rule::enabled)
                .filter(rule -> rule.type() == candidate.type())
                .filter(rule -> !rule.ruleId().equals(candidate.ruleId()))
                .filter(rule -> PatternSimilarity.isDuplicate(rule.pattern(), candidate.pattern()))
                .min(BY_ID);
    }

    public Optional<Rule> findById(String ruleId) {
        return rules().stream()
                .filter(rule -> rule.ruleId().equals(ruleId))
                .findFirst();
    }

    /**
     * First enabled rule, by id, whose pattern equals the given one exactly.
     */
    public Optional<Rule> findByPattern(String pattern) {
        return rules().stream()
                .filter(Rule::enabled)
                .filter(rule -> rule.pattern().equals(pattern))
                .min(BY_ID);
    }

    /**
     * Staging copy of the current rule set, backed by in-memory persistence.
     * Candidate versions are built on a fork and never touch this store.
     */
    public RuleStore fork() {
        RuleSetVersion snapshot = current.get();
        RuleStore staging = new RuleStore(new InMemoryRulePersistence(snapshot), bootstrapRules, clock);
        staging.current.set(snapshot);
        return staging;
    }

    private void mutate(UnaryOperator<List<Rule>> change) throws PersistenceException {
        RuleSetVersion snapshot = current.get();
        RuleSetVersion next = snapshot.withRules(change.apply(snapshot.rules()));
        persistence.saveVersion(next);
        current.set(next);
    }
}
