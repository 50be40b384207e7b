/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api;

import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.RuleSetVersion;

import java.util.Optional;

/**
 * Storage for rule-set snapshots. Every save fully replaces the latest
 * snapshot; callers never rely on partial merges.
 */
public interface RulePersistence {

    /**
     * @return the most recently saved snapshot, empty when nothing was saved yet
     */
    Optional<RuleSetVersion> loadLatestVersion() throws PersistenceException;

    void saveVersion(RuleSetVersion snapshot) throws PersistenceException;

    /**
     * Loads a specific historical snapshot, if retained.
     */
    Optional<RuleSetVersion> loadVersion(String version) throws PersistenceException;
}
