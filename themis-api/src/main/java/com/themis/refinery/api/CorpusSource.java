/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api;

import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.StratificationCriteria;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the document corpus.
 */
public interface CorpusSource {

    long count();

    Optional<DocumentCase> findCase(String caseId);

    /**
     * Returns up to {@code size} documents spread as evenly as possible over
     * the strata the criteria describe.
     */
    List<DocumentCase> stratifiedSample(StratificationCriteria criteria, int size);

    /**
     * Stable, offset-based paging used by full-corpus runs and checkpoints.
     */
    List<DocumentCase> page(long offset, int limit);
}
