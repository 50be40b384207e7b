/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.job;

import com.themis.refinery.api.model.ProcessingScale;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * All jobs of this process, kept after they finish.
 */
public final class JobRegistry {

    private final Map<String, ProcessingJob> jobs = new ConcurrentHashMap<>();
    private final List<ProcessingJob> order = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public String nextId(ProcessingScale scale) {
        return scale.name().toLowerCase(Locale.ROOT) + "-" + sequence.incrementAndGet();
    }

    public void register(ProcessingJob job) {
        if (jobs.putIfAbsent(job.jobId(), job) != null) {
            throw new IllegalArgumentException("Duplicate job id: " + job.jobId());
        }
        order.add(job);
    }

    public Optional<ProcessingJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<ProcessingJob> all() {
        return List.copyOf(order);
    }
}
