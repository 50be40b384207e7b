/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import java.util.List;

public record ReadinessVerdict(boolean ready, List<String> reasons) {

    public ReadinessVerdict {
        reasons = List.copyOf(reasons);
    }
}
