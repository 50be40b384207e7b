package com.themis.refinery.core.persistence;

import com.themis.refinery.api.RulePersistence;
import com.themis.refinery.api.model.RuleSetVersion;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory persistence for tests, staging forks and development.
 * Thread-safe.
 */
public final class InMemoryRulePersistence implements RulePersistence {

    private final Map<String, RuleSetVersion> versions = new ConcurrentHashMap<>();
    private volatile RuleSetVersion latest;

    public InMemoryRulePersistence() {
    }

    public InMemoryRulePersistence(RuleSetVersion initial) {
        saveVersion(initial);
    }

    @Override
    public Optional<RuleSetVersion> loadLatestVersion() {
        return Optional.ofNullable(latest);
    }

    @Override
    public void saveVersion(RuleSetVersion snapshot) {
        versions.put(snapshot.version(), snapshot);
        latest = snapshot;
    }

    @Override
    public Optional<RuleSetVersion> loadVersion(String version) {
        return Optional.ofNullable(versions.get(version));
    }

    public int versionCount() {
        return versions.size();
    }
}
