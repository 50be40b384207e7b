package com.themis.refinery.gates.unit;

import java.util.List;

/**
 * Input text and the output the rules are expected to produce for it.
 */
public record UnitFixture(String name, String input, String expected) {

    /**
     * Fixtures for the noise every rule set must keep removing.
     */
    public static List<UnitFixture> defaults() {
        return List.of(
                new UnitFixture("inline page number",
                        "내용... 페이지 1 ...더 많은 내용", "내용... ...더 많은 내용"),
                new UnitFixture("separator line",
                        "내용...\n---\n더 많은 내용", "내용...\n더 많은 내용"),
                new UnitFixture("repeated spaces",
                        "내용...    많은    공백", "내용... 많은 공백"));
    }
}
