/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.service.runner;

import com.themis.refinery.evolution.patch.PatchApplyReport;
import com.themis.refinery.gates.GateReport;

import java.util.Optional;

/**
 * What one evolution cycle did.
 *
 * @param candidateVersion version tagged for the candidate; {@code null} when nothing changed
 * @param gateReport       {@code null} when no gates ran
 * @param activeVersion    live version after the cycle
 */
public record CycleResult(
    Outcome outcome,
    int synthesized,
    PatchApplyReport applyReport,
    String candidateVersion,
    GateReport gateReport,
    String activeVersion
) {

    public enum Outcome {
        /** Nothing cleared the synthesis threshold. */
        NO_SUGGESTIONS,
        /** Candidates existed but none changed the rule set. */
        NO_CHANGES,
        PROMOTED,
        REJECTED
    }

    public static CycleResult noSuggestions(String activeVersion) {
        return new CycleResult(Outcome.NO_SUGGESTIONS, 0, PatchApplyReport.empty(), null, null, activeVersion);
    }

    public boolean promoted() {
        return outcome == Outcome.PROMOTED;
    }

    public Optional<GateReport> gates() {
        return Optional.ofNullable(gateReport);
    }
}
