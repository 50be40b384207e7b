/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

public enum ProcessingScale {
    SINGLE,
    BATCH,
    FULL
}
