/*
 * Copyright (c) 2025 Themis Refinery
 * Licensed under the Apache License, Version 2.0
 */
package com.themis.refinery.api.exception;

/**
 * Rule state could not be loaded or saved.
 *
 * <p>Halts the current evolution cycle; the job that triggered the
 * mutation moves to failed.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
