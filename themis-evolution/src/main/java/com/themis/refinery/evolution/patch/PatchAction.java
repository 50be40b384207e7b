package com.themis.refinery.evolution.patch;

public enum PatchAction {
    /** A new rule was inserted. */
    CREATED,
    /** An existing rule received the improved pattern. */
    UPDATED,
    /** An equivalent rule already existed; nothing changed. */
    ALREADY_PRESENT
}
