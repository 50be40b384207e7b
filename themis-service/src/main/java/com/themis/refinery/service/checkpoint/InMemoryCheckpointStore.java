/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(Checkpoint checkpoint) {
        checkpoints.put(checkpoint.jobId(), checkpoint);
    }

    @Override
    public Optional<Checkpoint> load(String jobId) {
        return Optional.ofNullable(checkpoints.get(jobId));
    }

    @Override
    public void delete(String jobId) {
        checkpoints.remove(jobId);
    }
}
