/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api;

/**
 * Exception thrown when a rule parameter string cannot describe a valid check,
 * such as a uniqueness rule without a resolvable {@code table.column}.
 * Raised on the first invocation of the misconfigured rule.
 */
public class RuleSpecificationException extends RuntimeException {

    private final String parameter;

    public RuleSpecificationException(String message, String parameter) {
        super(message + ": '" + parameter + "'");
        this.parameter = parameter;
    }

    public RuleSpecificationException(String message, String parameter, Throwable cause) {
        super(message + ": '" + parameter + "'", cause);
        this.parameter = parameter;
    }

    /**
     * @return the raw rule parameter that could not be interpreted
     */
    public String getParameter() {
        return parameter;
    }
}
