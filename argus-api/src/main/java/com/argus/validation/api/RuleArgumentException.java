/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api;

/**
 * Thrown when a rule is invoked without the parameters it cannot work without,
 * e.g. {@code required_with} called with no field list or no submission.
 *
 * <p>This is a programming error on the caller's side, not a validation failure,
 * so it is never converted into a {@code false} result.
 */
public class RuleArgumentException extends IllegalArgumentException {

    public RuleArgumentException(String message) {
        super(message);
    }

    public RuleArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
