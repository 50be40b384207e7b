/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Lineage entry for a tagged rule-set version.
 */
public record VersionRecord(
    @JsonProperty("version") String version,
    @JsonProperty("parent_version") String parentVersion,
    @JsonProperty("description") String description,
    @JsonProperty("checksum") String checksum,
    @JsonProperty("rule_count") int ruleCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("status") Status status
) {

    public enum Status {
        CANDIDATE,
        PROMOTED,
        REJECTED,
        ROLLED_BACK
    }

    public VersionRecord withStatus(Status newStatus) {
        return new VersionRecord(version, parentVersion, description, checksum,
                ruleCount, createdAt, newStatus);
    }
}
