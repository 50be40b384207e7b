/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.model;

import java.util.List;

/**
 * Dimensions a stratified sample is balanced across.
 */
public record StratificationCriteria(
    List<String> courtTypes,
    List<String> caseTypes,
    List<Integer> years,
    List<String> formatTypes
) {

    public StratificationCriteria {
        courtTypes = courtTypes == null ? List.of() : List.copyOf(courtTypes);
        caseTypes = caseTypes == null ? List.of() : List.copyOf(caseTypes);
        years = years == null ? List.of() : List.copyOf(years);
        formatTypes = formatTypes == null ? List.of() : List.copyOf(formatTypes);
    }

    public static StratificationCriteria defaults() {
        return new StratificationCriteria(
                List.of("고등법원", "지방법원", "행정법원"),
                List.of("민사", "형사", "행정"),
                List.of(2020, 2021, 2022, 2023, 2024),
                List.of("pdf", "hwp", "doc"));
    }

    /**
     * An empty dimension matches anything.
     */
    public boolean accepts(DocumentCase document) {
        return (courtTypes.isEmpty() || courtTypes.contains(document.courtType()))
                && (caseTypes.isEmpty() || caseTypes.contains(document.caseType()))
                && (years.isEmpty() || years.contains(document.year()))
                && (formatTypes.isEmpty() || formatTypes.contains(document.formatType()));
    }
}
