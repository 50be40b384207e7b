/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

/**
 * A rule that changed the text, with the text length around it.
 */
public record AppliedRule(
    String ruleId,
    RuleType type,
    String description,
    int lengthBefore,
    int lengthAfter
) {
}
