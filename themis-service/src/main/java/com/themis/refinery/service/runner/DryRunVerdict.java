/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import java.util.List;

/**
 * @param reasons criteria the dry run missed; empty when ready
 */
public record DryRunVerdict(boolean ready, DryRunStats stats, List<String> reasons) {

    public DryRunVerdict {
        reasons = List.copyOf(reasons);
    }
}
