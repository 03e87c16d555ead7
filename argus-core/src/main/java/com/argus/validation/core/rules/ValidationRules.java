/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.rules;

import com.argus.validation.api.ExistenceStore;
import com.argus.validation.api.IValidationRules;
import com.argus.validation.api.RuleArgumentException;
import com.argus.validation.api.RuleName;
import com.argus.validation.api.model.ExistenceQuery;
import com.argus.validation.api.model.PathValue;
import com.argus.validation.api.model.Submission;
import com.argus.validation.core.config.ValidationConfig;
import com.argus.validation.core.params.FieldList;
import com.argus.validation.core.params.NumericBound;
import com.argus.validation.core.params.NumericText;
import com.argus.validation.core.params.RuleParameterParser;
import com.argus.validation.core.params.UniqueSpec;
import com.argus.validation.core.path.DottedPathResolver;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The standard predicate set.
 *
 * <p>Three families of checks:
 * <ul>
 *   <li>Cross-field: {@code differs}, {@code matches}, {@code required_with}, {@code required_without}</li>
 *   <li>Scalar: equality, lengths, numeric ranges, list membership, {@code required}</li>
 *   <li>Persistence: {@code is_unique}, {@code is_not_unique} through an {@link ExistenceStore}</li>
 * </ul>
 *
 * <p>Lengths are counted in Unicode code points. Numeric rules parse both sides as
 * decimals; anything non-numeric fails the check rather than throwing.
 *
 * <p><b>Thread Safety:</b> No per-call state. The parameter cache is thread-safe, and the
 * store must be, so one instance can serve concurrent validation passes.
 */
public final class ValidationRules implements IValidationRules {

    private static final Logger logger = Logger.getLogger(ValidationRules.class.getName());

    private static final String MISSING_DEPENDENCIES = "You must supply the parameters: fields, data.";

    private final ExistenceStore store;
    private final ValidationConfig config;
    private final RuleParameterParser parser;

    /**
     * Rule set without persistence support; {@code is_unique} and {@code is_not_unique}
     * throw {@link IllegalStateException}.
     */
    public ValidationRules() {
        this(null, ValidationConfig.fromEnvironment());
    }

    public ValidationRules(ExistenceStore store) {
        this(store, ValidationConfig.fromEnvironment());
    }

    public ValidationRules(ExistenceStore store, ValidationConfig config) {
        this.store = store;
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.parser = new RuleParameterParser(config.parameterCacheSize());
        logger.info("ValidationRules initialized: persistence=" + (store != null) + ", " + config);
    }

    // ========================================================================
    // CROSS-FIELD
    // ========================================================================

    @Override
    public boolean differs(Object value, String field, Submission data) {
        Submission submission = orEmpty(data);
        if (DottedPathResolver.isDotted(field)) {
            return !lookup(field, submission).holds(value);
        }
        return submission.containsKey(field) && !Objects.equals(value, submission.get(field));
    }

    @Override
    public boolean matches(Object value, String field, Submission data) {
        Submission submission = orEmpty(data);
        if (DottedPathResolver.isDotted(field)) {
            return lookup(field, submission).holds(value);
        }
        return submission.containsKey(field) && Objects.equals(value, submission.get(field));
    }

    @Override
    public boolean requiredWith(Object value, String fields, Submission data) {
        FieldList dependencies = dependencies(fields, data);

        // A filled value satisfies the rule whatever the other fields hold
        if (required(value)) {
            return true;
        }

        for (String field : dependencies.fields()) {
            if (isFilled(field, data)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean requiredWithout(Object value, String fields, Submission data) {
        FieldList dependencies = dependencies(fields, data);

        if (required(value)) {
            return true;
        }

        for (String field : dependencies.fields()) {
            if (!isFilled(field, data)) {
                return false;
            }
        }
        return true;
    }

    // ========================================================================
    // SCALAR
    // ========================================================================

    @Override
    public boolean equals(String value, String expected) {
        return Objects.equals(value, expected);
    }

    @Override
    public boolean notEquals(String value, String expected) {
        return !Objects.equals(value, expected);
    }

    @Override
    public boolean exactLength(String value, String lengths) {
        return parser.lengthSet(lengths).accepts(length(value));
    }

    @Override
    public boolean greaterThan(String value, String min) {
        Integer order = compareNumeric(value, min);
        return order != null && order > 0;
    }

    @Override
    public boolean greaterThanEqualTo(String value, String min) {
        Integer order = compareNumeric(value, min);
        return order != null && order >= 0;
    }

    @Override
    public boolean lessThan(String value, String max) {
        Integer order = compareNumeric(value, max);
        return order != null && order < 0;
    }

    @Override
    public boolean lessThanEqualTo(String value, String max) {
        Integer order = compareNumeric(value, max);
        return order != null && order <= 0;
    }

    @Override
    public boolean maxLength(String value, String max) {
        Integer order = parser.numericBound(max).compare(BigDecimal.valueOf(length(value)));
        return order != null && order <= 0;
    }

    @Override
    public boolean minLength(String value, String min) {
        Integer order = parser.numericBound(min).compare(BigDecimal.valueOf(length(value)));
        return order != null && order >= 0;
    }

    @Override
    public boolean inList(String value, String list) {
        return parser.valueList(list).contains(value);
    }

    @Override
    public boolean notInList(String value, String list) {
        return !inList(value, list);
    }

    @Override
    public boolean required(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return !text.toString().trim().isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    // ========================================================================
    // PERSISTENCE
    // ========================================================================

    @Override
    public boolean isUnique(String value, String spec, Submission data) {
        UniqueSpec unique = parser.uniqueSpec(spec);
        ExistenceQuery query = new ExistenceQuery(
                unique.table(), unique.column(), value, unique.exclusion(), connectionGroup(data));
        logger.fine(() -> "is_unique query: " + query);
        return !existenceStore().exists(query);
    }

    @Override
    public boolean isNotUnique(String value, String spec, Submission data) {
        UniqueSpec unique = parser.uniqueSpec(spec);
        ExistenceQuery query = new ExistenceQuery(
                unique.table(), unique.column(), value, unique.requirement(), connectionGroup(data));
        logger.fine(() -> "is_not_unique query: " + query);
        return existenceStore().exists(query);
    }

    // ========================================================================
    // DISPATCH
    // ========================================================================

    @Override
    public boolean evaluate(RuleName rule, Object value, String param, Submission data) {
        Objects.requireNonNull(rule, "rule cannot be null");

        if (rule.scope() != RuleName.Scope.SUBMISSION && rule != RuleName.REQUIRED && !isScalar(value)) {
            // Structured values cannot satisfy a string rule
            return false;
        }
        String text = value == null ? null : value.toString();

        return switch (rule) {
            case DIFFERS -> differs(value, param, data);
            case MATCHES -> matches(value, param, data);
            case REQUIRED_WITH -> requiredWith(value, param, data);
            case REQUIRED_WITHOUT -> requiredWithout(value, param, data);
            case EQUALS -> equals(text, param);
            case NOT_EQUALS -> notEquals(text, param);
            case EXACT_LENGTH -> exactLength(text, param);
            case GREATER_THAN -> greaterThan(text, param);
            case GREATER_THAN_EQUAL_TO -> greaterThanEqualTo(text, param);
            case LESS_THAN -> lessThan(text, param);
            case LESS_THAN_EQUAL_TO -> lessThanEqualTo(text, param);
            case MAX_LENGTH -> maxLength(text, param);
            case MIN_LENGTH -> minLength(text, param);
            case IN_LIST -> inList(text, param);
            case NOT_IN_LIST -> notInList(text, param);
            case REQUIRED -> required(value);
            case IS_UNIQUE -> isUnique(text, param, data);
            case IS_NOT_UNIQUE -> isNotUnique(text, param, data);
        };
    }

    public RuleParameterParser parameterParser() {
        return parser;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private FieldList dependencies(String fields, Submission data) {
        if (fields == null || data == null || data.isEmpty()) {
            throw new RuleArgumentException(MISSING_DEPENDENCIES);
        }
        return parser.fieldList(fields);
    }

    /**
     * A dependency counts as filled when it exists and holds something other than
     * null, an empty string or an empty collection.
     */
    private boolean isFilled(String field, Submission data) {
        if (DottedPathResolver.isDotted(field)) {
            PathValue resolved = lookup(field, data);
            return resolved.isFound() && !isEmptyValue(resolved.value());
        }
        return data.containsKey(field) && !isEmptyValue(data.get(field));
    }

    private static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return value.getClass().isArray() && Array.getLength(value) == 0;
    }

    private static PathValue lookup(String field, Submission data) {
        return DottedPathResolver.resolve(field, data.asMap());
    }

    private Integer compareNumeric(String value, String bound) {
        BigDecimal number = NumericText.parse(value);
        if (number == null) {
            return null;
        }
        NumericBound limit = parser.numericBound(bound);
        return limit.compare(number);
    }

    private static int length(String value) {
        return value == null ? 0 : value.codePointCount(0, value.length());
    }

    private static boolean isScalar(Object value) {
        return value == null
                || value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character;
    }

    private String connectionGroup(Submission data) {
        return orEmpty(data).connectionGroup(config.connectionGroupKey());
    }

    private ExistenceStore existenceStore() {
        if (store == null) {
            throw new IllegalStateException("No ExistenceStore configured; is_unique and is_not_unique are unavailable");
        }
        return store;
    }

    private static Submission orEmpty(Submission data) {
        return data == null ? Submission.empty() : data;
    }
}
