/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.themis.refinery.evolution.patch.RollbackOutcome;

/**
 * Result of undoing a single patch.
 *
 * @param activeVersion live version afterwards; unchanged when the rollback was refused
 */
public record PatchRollbackResult(RollbackOutcome outcome, String activeVersion) {

    public boolean success() {
        return outcome.success();
    }
}
