/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api;

import com.argus.validation.api.model.Submission;

/**
 * Contract for the field-validation predicate set.
 *
 * <p>Every predicate tests one value and returns {@code true} when it passes.
 * A {@code false} result is an ordinary validation failure; exceptions are
 * reserved for misconfigured rules and unreadable stores.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IValidationRules rules = // obtain from factory or DI
 *
 * Submission form = Submission.of(Map.of(
 *     "email", "a@b.com",
 *     "password", "secret"
 * ));
 *
 * boolean ok = rules.requiredWith(form.get("password_confirm"), "password", form)
 *         && rules.isUnique("a@b.com", "users.email", form);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe and free of per-call state.
 * Only {@link #isUnique} and {@link #isNotUnique} perform I/O.
 */
public interface IValidationRules {

    // ---- cross-field ----

    /**
     * The value does not equal the field referenced by {@code field}.
     * A plain field name must exist in the submission; a dotted reference is
     * resolved into nested data and a missing path counts as different.
     */
    boolean differs(Object value, String field, Submission data);

    /**
     * The value equals the field referenced by {@code field}.
     * Lookup rules are the same as {@link #differs}.
     */
    boolean matches(Object value, String field, Submission data);

    /**
     * The value is required when any of the comma-separated {@code fields} is
     * present and non-empty in the submission.
     *
     * @throws RuleArgumentException if {@code fields} is null or {@code data} is null or empty
     */
    boolean requiredWith(Object value, String fields, Submission data);

    /**
     * The value is required unless all of the comma-separated {@code fields}
     * are present and non-empty in the submission.
     *
     * @throws RuleArgumentException if {@code fields} is null or {@code data} is null or empty
     */
    boolean requiredWithout(Object value, String fields, Submission data);

    // ---- scalar ----

    boolean equals(String value, String expected);

    boolean notEquals(String value, String expected);

    /**
     * @param lengths one length ("5") or several ("5,8,12"); non-numeric entries are ignored
     */
    boolean exactLength(String value, String lengths);

    boolean greaterThan(String value, String min);

    boolean greaterThanEqualTo(String value, String min);

    boolean lessThan(String value, String max);

    boolean lessThanEqualTo(String value, String max);

    boolean maxLength(String value, String max);

    boolean minLength(String value, String min);

    boolean inList(String value, String list);

    boolean notInList(String value, String list);

    /**
     * Collections, maps and arrays must be non-empty, strings non-blank after trimming,
     * and any other non-null object is considered present.
     */
    boolean required(Object value);

    // ---- persistence ----

    /**
     * No row in {@code table} has {@code column == value}.
     *
     * @param spec {@code table.column[,ignoreColumn,ignoreValue]}
     * @throws RuleSpecificationException if the spec has no table or column
     * @throws DataStoreException if the store cannot be read
     */
    boolean isUnique(String value, String spec, Submission data);

    /**
     * At least one row in {@code table} has {@code column == value}.
     *
     * @param spec {@code table.column[,whereColumn,whereValue]}
     * @throws RuleSpecificationException if the spec has no table or column
     * @throws DataStoreException if the store cannot be read
     */
    boolean isNotUnique(String value, String spec, Submission data);

    /**
     * Invokes the predicate selected by {@code rule}.
     *
     * <p>Rules that do not take a parameter or a submission ignore those arguments.
     * No ordering or short-circuit policy is applied here.
     *
     * @param rule the predicate to run
     * @param value the value under test
     * @param param the rule's parameter string, may be null for {@code required}
     * @param data the full submission, may be {@link Submission#empty()}
     * @return true if the value passes
     */
    boolean evaluate(RuleName rule, Object value, String param, Submission data);
}
