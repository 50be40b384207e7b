package com.themis.refinery.core.version;

import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.VersionRecord;
import com.themis.refinery.api.model.VersionRecord.Status;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Assigns semantic versions to rule-set snapshots and keeps their lineage.
 *
 * <p>Two pointers are tracked: the last version number handed out and the
 * active (promoted) version. Version numbers are never reused, so a rejected
 * candidate keeps its number in the lineage and the next candidate gets a
 * fresh one. Thread-safe.
 */
public final class VersionManager {
    private static final Logger logger = Logger.getLogger(VersionManager.class.getName());

    private final Clock clock;
    private final Map<String, VersionRecord> records = new LinkedHashMap<>();
    private SemanticVersion latestAssigned;
    private SemanticVersion active;

    public VersionManager(String activeVersion) {
        this(activeVersion, Clock.systemUTC());
    }

    public VersionManager(String activeVersion, Clock clock) {
        this.clock = clock;
        this.active = SemanticVersion.parse(activeVersion);
        this.latestAssigned = active;
    }

    public synchronized String activeVersion() {
        return active.toString();
    }

    /**
     * Returns the next version after everything handed out so far.
     */
    public synchronized String incrementVersion(VersionBump kind) {
        SemanticVersion base = latestAssigned.compareTo(active) >= 0 ? latestAssigned : active;
        latestAssigned = base.bump(kind);
        return latestAssigned.toString();
    }

    /**
     * Tags the most recently assigned version with the given rules.
     */
    public synchronized VersionRecord tag(List<Rule> rules, String description) {
        return tag(latestAssigned.toString(), rules, description);
    }

    public synchronized VersionRecord tag(String version, List<Rule> rules, String description) {
        SemanticVersion parsed = SemanticVersion.parse(version);
        if (parsed.compareTo(latestAssigned) > 0) {
            latestAssigned = parsed;
        }
        VersionRecord record = new VersionRecord(parsed.toString(), active.toString(), description,
                RuleSetChecksum.of(rules), rules.size(), clock.instant(), Status.CANDIDATE);
        records.put(record.version(), record);
        logger.info(String.format("Tagged %s (parent %s, %d rules, checksum %s)",
                record.version(), record.parentVersion(), record.ruleCount(),
                record.checksum().substring(0, 12)));
        return record;
    }

    public synchronized VersionRecord markPromoted(String version) {
        VersionRecord promoted = updateStatus(version, Status.PROMOTED);
        active = SemanticVersion.parse(version);
        return promoted;
    }

    public synchronized VersionRecord markRejected(String version) {
        return updateStatus(version, Status.REJECTED);
    }

    /**
     * Marks the version rolled back and re-activates its parent.
     */
    public synchronized VersionRecord markRolledBack(String version) {
        VersionRecord rolledBack = updateStatus(version, Status.ROLLED_BACK);
        if (rolledBack.parentVersion() != null && active.toString().equals(rolledBack.version())) {
            active = SemanticVersion.parse(rolledBack.parentVersion());
        }
        return rolledBack;
    }

    public synchronized Optional<VersionRecord> find(String version) {
        return Optional.ofNullable(records.get(version));
    }

    /**
     * The version followed by its ancestors, as far as they were tagged here.
     */
    public synchronized List<VersionRecord> lineage(String version) {
        List<VersionRecord> chain = new ArrayList<>();
        VersionRecord cursor = records.get(version);
        while (cursor != null && !chain.contains(cursor)) {
            chain.add(cursor);
            cursor = cursor.parentVersion() != null ? records.get(cursor.parentVersion()) : null;
        }
        return chain;
    }

    /**
     * Closest promoted ancestor of the given version.
     */
    public synchronized Optional<VersionRecord> previousStable(String version) {
        return lineage(version).stream()
                .skip(1)
                .filter(record -> record.status() == Status.PROMOTED)
                .findFirst();
    }

    public synchronized List<VersionRecord> records() {
        return List.copyOf(records.values());
    }

    public boolean verify(List<Rule> rules, String checksum) {
        return RuleSetChecksum.of(rules).equals(checksum);
    }

    private VersionRecord updateStatus(String version, Status status) {
        VersionRecord existing = records.get(version);
        if (existing == null) {
            throw new IllegalArgumentException("Unknown version: " + version);
        }
        VersionRecord updated = existing.withStatus(status);
        records.put(version, updated);
        return updated;
    }
}
