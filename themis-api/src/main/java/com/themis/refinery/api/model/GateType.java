/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Safety gates in execution order.
 */
public enum GateType {
    UNIT,
    REGRESSION,
    HOLDOUT,
    PERFORMANCE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
