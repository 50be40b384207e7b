/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.config;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Tunables of the refinery, read from MicroProfile Config ({@code themis.*}
 * keys). Defaults live in {@code META-INF/microprofile-config.properties};
 * system properties and environment variables override them.
 */
public record RefinerySettings(
    double autoApplyThreshold,
    double synthesisThreshold,
    Duration evaluatorTimeout,
    Duration oscillationWindow,
    Duration oscillationCooldown,
    boolean factExtractionEnabled,
    int readinessPasses,
    int batchSampleSize,
    int batchConcurrency,
    int batchSampleCap,
    int stabilizationCycles,
    int holdoutSize,
    int fullBatchSize,
    int fullConcurrency,
    double dryRunFraction,
    double dryRunMinAvailability,
    int dryRunBatchSize,
    double costBudget,
    Duration stabilityWindow,
    int recentErrorLimit,
    Optional<Path> dataDirectory
) {

    public RefinerySettings {
        requireFraction("autoApplyThreshold", autoApplyThreshold);
        requireFraction("synthesisThreshold", synthesisThreshold);
        requireFraction("dryRunFraction", dryRunFraction);
        requireFraction("dryRunMinAvailability", dryRunMinAvailability);
        requirePositive("readinessPasses", readinessPasses);
        requirePositive("batchSampleSize", batchSampleSize);
        requirePositive("batchConcurrency", batchConcurrency);
        requirePositive("batchSampleCap", batchSampleCap);
        requirePositive("stabilizationCycles", stabilizationCycles);
        requirePositive("fullBatchSize", fullBatchSize);
        requirePositive("fullConcurrency", fullConcurrency);
        requirePositive("dryRunBatchSize", dryRunBatchSize);
        requirePositive("recentErrorLimit", recentErrorLimit);
        if (holdoutSize < 0) {
            throw new IllegalArgumentException("holdoutSize must not be negative");
        }
        if (costBudget < 0) {
            throw new IllegalArgumentException("costBudget must not be negative");
        }
        if (dataDirectory == null) {
            dataDirectory = Optional.empty();
        }
    }

    public static RefinerySettings load() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static RefinerySettings fromConfig(Config config) {
        return new RefinerySettings(
                config.getOptionalValue("themis.patch.auto-apply-threshold", Double.class).orElse(0.8),
                config.getOptionalValue("themis.patch.synthesis-threshold", Double.class).orElse(0.7),
                seconds(config, "themis.evaluator.timeout-seconds", 60),
                seconds(config, "themis.oscillation.window-seconds", 3_600),
                seconds(config, "themis.oscillation.cooldown-seconds", 86_400),
                config.getOptionalValue("themis.engine.fact-extraction.enabled", Boolean.class).orElse(false),
                config.getOptionalValue("themis.single.readiness-passes", Integer.class).orElse(20),
                config.getOptionalValue("themis.batch.sample-size", Integer.class).orElse(50),
                config.getOptionalValue("themis.batch.concurrency", Integer.class).orElse(5),
                config.getOptionalValue("themis.batch.sample-cap", Integer.class).orElse(5_000),
                config.getOptionalValue("themis.batch.stabilization-cycles", Integer.class).orElse(3),
                config.getOptionalValue("themis.gates.holdout-size", Integer.class).orElse(20),
                config.getOptionalValue("themis.full.batch-size", Integer.class).orElse(1_000),
                config.getOptionalValue("themis.full.concurrency", Integer.class).orElse(10),
                config.getOptionalValue("themis.full.dry-run.fraction", Double.class).orElse(0.01),
                config.getOptionalValue("themis.full.dry-run.min-availability", Double.class).orElse(0.9),
                config.getOptionalValue("themis.full.dry-run.batch-size", Integer.class).orElse(100),
                config.getOptionalValue("themis.full.cost-budget", Double.class).orElse(5_000.0),
                seconds(config, "themis.full.stability-window-seconds", 3_600),
                config.getOptionalValue("themis.jobs.recent-error-limit", Integer.class).orElse(20),
                config.getOptionalValue("themis.data.directory", String.class)
                        .filter(value -> !value.isBlank())
                        .map(Path::of));
    }

    private static Duration seconds(Config config, String key, long defaultSeconds) {
        return Duration.ofSeconds(config.getOptionalValue(key, Long.class).orElse(defaultSeconds));
    }

    private static void requireFraction(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
