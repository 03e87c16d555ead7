/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The named predicates a caller can select.
 *
 * Each constant carries the conventional snake_case rule name used in rule
 * definitions (e.g. {@code "is_unique"}), plus the kind of context it needs.
 */
public enum RuleName {
    DIFFERS("differs", Scope.SUBMISSION),
    MATCHES("matches", Scope.SUBMISSION),
    REQUIRED_WITH("required_with", Scope.SUBMISSION),
    REQUIRED_WITHOUT("required_without", Scope.SUBMISSION),

    EQUALS("equals", Scope.VALUE),
    NOT_EQUALS("not_equals", Scope.VALUE),
    EXACT_LENGTH("exact_length", Scope.VALUE),
    GREATER_THAN("greater_than", Scope.VALUE),
    GREATER_THAN_EQUAL_TO("greater_than_equal_to", Scope.VALUE),
    LESS_THAN("less_than", Scope.VALUE),
    LESS_THAN_EQUAL_TO("less_than_equal_to", Scope.VALUE),
    MAX_LENGTH("max_length", Scope.VALUE),
    MIN_LENGTH("min_length", Scope.VALUE),
    IN_LIST("in_list", Scope.VALUE),
    NOT_IN_LIST("not_in_list", Scope.VALUE),
    REQUIRED("required", Scope.VALUE),

    IS_UNIQUE("is_unique", Scope.PERSISTENCE),
    IS_NOT_UNIQUE("is_not_unique", Scope.PERSISTENCE);

    /**
     * What a rule reads besides the value under test.
     */
    public enum Scope {
        /** Only the value and the static parameter */
        VALUE,
        /** Sibling fields of the same submission */
        SUBMISSION,
        /** An external existence store */
        PERSISTENCE
    }

    private final String ruleName;
    private final Scope scope;

    RuleName(String ruleName, Scope scope) {
        this.ruleName = ruleName;
        this.scope = scope;
    }

    /**
     * Safely converts a rule name to its constant.
     * Accepts both the snake_case rule name ("in_list") and the constant name ("IN_LIST").
     *
     * @param text the rule name
     * @return the corresponding RuleName, or null if not found
     */
    @JsonCreator
    public static RuleName fromString(String text) {
        if (text == null) return null;
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (RuleName name : values()) {
            if (name.ruleName.equals(normalized)) {
                return name;
            }
        }
        return null;
    }

    @JsonValue
    public String ruleName() {
        return ruleName;
    }

    public Scope scope() {
        return scope;
    }

    public boolean needsPersistence() {
        return scope == Scope.PERSISTENCE;
    }
}
