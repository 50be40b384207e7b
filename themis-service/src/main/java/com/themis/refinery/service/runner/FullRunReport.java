/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * @param readinessReasons unmet preconditions; empty when the run was allowed
 * @param dryRun           {@code null} when the run resumed from a checkpoint
 */
public record FullRunReport(
    Outcome outcome,
    List<String> readinessReasons,
    DryRunVerdict dryRun,
    long processed,
    long failed,
    int completedBatches,
    long nextOffset
) {

    public enum Outcome {
        COMPLETED,
        PAUSED,
        CANCELLED,
        NOT_READY,
        DRY_RUN_FAILED
    }

    public FullRunReport {
        readinessReasons = List.copyOf(readinessReasons);
    }

    static FullRunReport notReady(List<String> reasons) {
        return new FullRunReport(Outcome.NOT_READY, reasons, null, 0, 0, 0, 0);
    }

    static FullRunReport dryRunFailed(DryRunVerdict verdict) {
        return new FullRunReport(Outcome.DRY_RUN_FAILED, List.of(), verdict, 0, 0, 0, 0);
    }

    public Map<String, Object> toResult() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
        result.put("readiness_reasons", readinessReasons);
        if (dryRun != null) {
            result.put("dry_run", dryRun.stats());
            result.put("dry_run_reasons", dryRun.reasons());
        }
        result.put("processed", processed);
        result.put("failed", failed);
        result.put("completed_batches", completedBatches);
        result.put("next_offset", nextOffset);
        return result;
    }
}
