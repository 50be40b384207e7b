/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.checkpoint;

import com.themis.refinery.api.exception.PersistenceException;

import java.util.Optional;

public interface CheckpointStore {

    /**
     * Replaces the job's checkpoint.
     */
    void save(Checkpoint checkpoint) throws PersistenceException;

    Optional<Checkpoint> load(String jobId) throws PersistenceException;

    void delete(String jobId) throws PersistenceException;
}
