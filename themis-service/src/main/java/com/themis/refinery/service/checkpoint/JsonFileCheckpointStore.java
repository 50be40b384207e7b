/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.core.persistence.JsonMappers;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * One JSON file per job under {@code <directory>/checkpoints}, replaced
 * atomically on every save.
 */
public final class JsonFileCheckpointStore implements CheckpointStore {
    private static final Logger logger = Logger.getLogger(JsonFileCheckpointStore.class.getName());

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileCheckpointStore(Path directory) {
        this(directory, JsonMappers.create());
    }

    public JsonFileCheckpointStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory.resolve("checkpoints");
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void save(Checkpoint checkpoint) throws PersistenceException {
        Path target = fileFor(checkpoint.jobId());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(temp.toFile(), checkpoint);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.fine("Atomic move not supported for " + target + ", falling back to plain replace");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to save checkpoint for job " + checkpoint.jobId(), e);
        }
    }

    @Override
    public synchronized Optional<Checkpoint> load(String jobId) throws PersistenceException {
        Path file = fileFor(jobId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Checkpoint.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read checkpoint " + file, e);
        }
    }

    @Override
    public synchronized void delete(String jobId) throws PersistenceException {
        try {
            Files.deleteIfExists(fileFor(jobId));
        } catch (IOException e) {
            throw new PersistenceException("Failed to delete checkpoint for job " + jobId, e);
        }
    }

    private Path fileFor(String jobId) throws PersistenceException {
        if (!SAFE_ID.matcher(jobId).matches()) {
            throw new PersistenceException("Illegal job id: " + jobId);
        }
        return directory.resolve(jobId + ".json");
    }
}
