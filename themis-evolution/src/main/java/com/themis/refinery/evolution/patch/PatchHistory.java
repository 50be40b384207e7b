package com.themis.refinery.evolution.patch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of applied patches. Thread-safe.
 */
public final class PatchHistory {

    private final List<PatchRecord> records = new ArrayList<>();

    public synchronized void append(PatchRecord record) {
        records.add(record);
    }

    public synchronized void appendAll(Collection<PatchRecord> staged) {
        records.addAll(staged);
    }

    public synchronized Optional<PatchRecord> find(String patchId) {
        return records.stream()
                .filter(record -> record.patchId().equals(patchId))
                .findFirst();
    }

    public synchronized List<PatchRecord> records() {
        return List.copyOf(records);
    }

    public synchronized int size() {
        return records.size();
    }

    /**
     * Independent copy, for staging rollbacks before they are promoted.
     */
    public synchronized PatchHistory copy() {
        PatchHistory copy = new PatchHistory();
        copy.records.addAll(records);
        return copy;
    }

    /**
     * Adopts the records of a promoted staging copy.
     */
    public void replaceWith(PatchHistory staged) {
        List<PatchRecord> promoted = staged.records();
        synchronized (this) {
            records.clear();
            records.addAll(promoted);
        }
    }

    synchronized void markRolledBack(String patchId) {
        records.replaceAll(record -> record.patchId().equals(patchId) ? record.markRolledBack() : record);
    }
}
