package com.themis.refinery.evolution.patch;

public record RollbackOutcome(boolean success, String message) {

    static RollbackOutcome success(String message) {
        return new RollbackOutcome(true, message);
    }

    static RollbackOutcome failure(String message) {
        return new RollbackOutcome(false, message);
    }
}
