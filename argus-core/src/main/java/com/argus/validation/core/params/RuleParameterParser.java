/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.params;

import com.argus.validation.api.RuleSpecificationException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Turns a rule's single parameter string into a typed, validated parameter record.
 *
 * <p>Every rule takes one string whose shape the rule itself defines
 * ({@code "5,8,12"}, {@code "users.email,id,5"}, {@code "password,email"}).
 * Parsing happens here once per distinct (kind, string) pair; results are kept in a
 * bounded Caffeine cache shared by all invocations. Parse failures are thrown and
 * not cached.
 *
 * <p><b>Thread Safety:</b> safe for concurrent use; parsed records are immutable.
 */
public final class RuleParameterParser {

    private static final Logger logger = Logger.getLogger(RuleParameterParser.class.getName());

    private static final Pattern PLACEHOLDER = Pattern.compile("^\\{(\\w+)\\}$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private enum Kind { FIELD_LIST, LENGTH_SET, NUMERIC_BOUND, VALUE_LIST, UNIQUE_SPEC }

    private record ParameterKey(Kind kind, String raw) {
    }

    private final Cache<ParameterKey, Object> cache;

    public RuleParameterParser(long maxCachedParameters) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxCachedParameters)
                .recordStats()
                .build();
        logger.fine("RuleParameterParser initialized: maxSize=" + maxCachedParameters);
    }

    /**
     * {@code "a,b.c"} to the dependent field names, each trimmed; blank names are dropped.
     */
    public FieldList fieldList(String raw) {
        Objects.requireNonNull(raw, "field list cannot be null");
        return cached(Kind.FIELD_LIST, raw, FieldList.class, r -> new FieldList(splitTrimmed(r, true)));
    }

    /**
     * {@code "5,8,12"} to the numeric lengths; non-numeric entries are ignored.
     */
    public LengthSet lengthSet(String raw) {
        if (raw == null) {
            return new LengthSet(List.of());
        }
        return cached(Kind.LENGTH_SET, raw, LengthSet.class, r -> {
            List<BigDecimal> lengths = new ArrayList<>();
            for (String entry : r.split(",", -1)) {
                BigDecimal length = NumericText.parse(entry);
                if (length != null) {
                    lengths.add(length);
                }
            }
            return new LengthSet(lengths);
        });
    }

    public NumericBound numericBound(String raw) {
        if (raw == null) {
            return NumericBound.NOT_NUMERIC;
        }
        return cached(Kind.NUMERIC_BOUND, raw, NumericBound.class, r -> {
            BigDecimal bound = NumericText.parse(r);
            return bound == null ? NumericBound.NOT_NUMERIC : new NumericBound(bound);
        });
    }

    /**
     * {@code " a , b ,c"} to {@code [a, b, c]}. Empty entries are kept as empty strings.
     */
    public ValueList valueList(String raw) {
        if (raw == null) {
            return new ValueList(List.of());
        }
        return cached(Kind.VALUE_LIST, raw, ValueList.class, r -> new ValueList(splitTrimmed(r, false)));
    }

    /**
     * {@code table.column[,filterColumn,filterValue]}.
     *
     * @throws RuleSpecificationException if table or column is missing, or any identifier
     *                                    is not a plain SQL name
     */
    public UniqueSpec uniqueSpec(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new RuleSpecificationException("Uniqueness rule needs table.column", String.valueOf(raw));
        }
        return cached(Kind.UNIQUE_SPEC, raw, UniqueSpec.class, RuleParameterParser::parseUniqueSpec);
    }

    /**
     * @return true if the text is an unresolved {@code {field}} placeholder
     */
    public static boolean isPlaceholder(String value) {
        return value != null && PLACEHOLDER.matcher(value).matches();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long cachedParameterCount() {
        return cache.estimatedSize();
    }

    // ========================================================================
    // PARSING
    // ========================================================================

    private <T> T cached(Kind kind, String raw, Class<T> type, Function<String, T> parser) {
        Object parsed = cache.get(new ParameterKey(kind, raw), key -> parser.apply(key.raw()));
        return type.cast(parsed);
    }

    private static List<String> splitTrimmed(String raw, boolean dropBlank) {
        List<String> parts = new ArrayList<>();
        for (String part : raw.split(",", -1)) {
            String trimmed = part.trim();
            if (dropBlank && trimmed.isEmpty()) {
                continue;
            }
            parts.add(trimmed);
        }
        return parts;
    }

    private static UniqueSpec parseUniqueSpec(String raw) {
        String[] parts = raw.split(",", -1);
        String target = parts[0].trim();

        int dot = target.indexOf('.');
        if (dot <= 0 || dot == target.length() - 1) {
            throw new RuleSpecificationException("Uniqueness rule needs table.column", raw);
        }
        String table = target.substring(0, dot);
        String column = target.substring(dot + 1);
        int extra = column.indexOf('.');
        if (extra >= 0) {
            // Only the first two dotted segments are significant
            column = column.substring(0, extra);
            if (column.isEmpty()) {
                throw new RuleSpecificationException("Uniqueness rule needs table.column", raw);
            }
        }
        requireIdentifier(table, raw);
        requireIdentifier(column, raw);

        String filterColumn = parts.length > 1 ? parts[1].trim() : "";
        String filterValue = parts.length > 2 ? parts[2].trim() : "";
        if (filterColumn.isEmpty() || filterValue.isEmpty() || isPlaceholder(filterValue)) {
            return new UniqueSpec(table, column, null, null);
        }
        requireIdentifier(filterColumn, raw);
        return new UniqueSpec(table, column, filterColumn, filterValue);
    }

    private static void requireIdentifier(String name, String raw) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new RuleSpecificationException("Illegal identifier '" + name + "' in uniqueness rule", raw);
        }
    }
}
