/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

/**
 * Recommendation after a stratified batch cycle.
 */
public enum NextAction {
    SCALE_UP("scale_up"),
    RETRY_SAME_SCALE("retry_same_scale"),
    STABILIZED("stabilized");

    private final String code;

    NextAction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
