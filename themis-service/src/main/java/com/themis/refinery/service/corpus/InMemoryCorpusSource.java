/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.corpus;

import com.themis.refinery.api.CorpusSource;
import com.themis.refinery.api.model.DocumentCase;
import com.themis.refinery.api.model.StratificationCriteria;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Corpus held in memory, in insertion order.
 *
 * <p>Stratified samples group accepted documents by (court type, case type,
 * year) and take one document per stratum in turn until the requested size
 * is reached, so small samples still cover as many strata as possible.
 */
public final class InMemoryCorpusSource implements CorpusSource {

    private final List<DocumentCase> documents;
    private final Map<String, DocumentCase> byId;

    public InMemoryCorpusSource(Collection<DocumentCase> documents) {
        this.documents = List.copyOf(documents);
        this.byId = new LinkedHashMap<>();
        for (DocumentCase document : this.documents) {
            byId.putIfAbsent(document.caseId(), document);
        }
    }

    @Override
    public long count() {
        return documents.size();
    }

    @Override
    public Optional<DocumentCase> findCase(String caseId) {
        return Optional.ofNullable(byId.get(caseId));
    }

    @Override
    public List<DocumentCase> stratifiedSample(StratificationCriteria criteria, int size) {
        if (size <= 0) {
            return List.of();
        }
        Map<String, Deque<DocumentCase>> strata = new LinkedHashMap<>();
        for (DocumentCase document : documents) {
            if (criteria.accepts(document)) {
                strata.computeIfAbsent(stratumOf(document), key -> new ArrayDeque<>()).addLast(document);
            }
        }

        List<DocumentCase> sample = new ArrayList<>(size);
        while (sample.size() < size && !strata.isEmpty()) {
            var iterator = strata.values().iterator();
            while (iterator.hasNext() && sample.size() < size) {
                Deque<DocumentCase> stratum = iterator.next();
                sample.add(stratum.pollFirst());
                if (stratum.isEmpty()) {
                    iterator.remove();
                }
            }
        }
        return sample;
    }

    @Override
    public List<DocumentCase> page(long offset, int limit) {
        if (offset < 0 || limit <= 0 || offset >= documents.size()) {
            return List.of();
        }
        int from = (int) offset;
        int to = (int) Math.min((long) documents.size(), offset + limit);
        return documents.subList(from, to);
    }

    private static String stratumOf(DocumentCase document) {
        return document.courtType() + "|" + document.caseType() + "|" + document.year();
    }
}
