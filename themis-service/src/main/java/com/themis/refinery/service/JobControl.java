/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service;

import com.themis.refinery.api.model.ProcessingScale;
import com.themis.refinery.service.job.JobOptions;
import com.themis.refinery.service.job.JobSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Control surface for processing jobs.
 */
public interface JobControl {

    /**
     * Queues a job; jobs run one at a time in submission order.
     *
     * @return the new job's id
     * @throws IllegalArgumentException when the options do not fit the scale
     */
    String start(ProcessingScale scale, JobOptions options);

    /**
     * Requests cancellation. A running job finishes its current batch first.
     *
     * @return false when the job is unknown or already finished
     */
    boolean stop(String jobId);

    /**
     * Requests a pause at the next batch boundary. Only full-corpus jobs pause.
     */
    boolean pause(String jobId);

    /**
     * Continues a paused job from its last checkpoint.
     */
    boolean resume(String jobId);

    Optional<JobSnapshot> status(String jobId);

    List<JobSnapshot> jobs();
}
