/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The full set of submitted field values, as seen by cross-field and
 * persistence-backed rules.
 *
 * <p>Values are usually strings but may be nested {@link Map}s and
 * {@link java.util.List}s; field names may themselves contain dots.
 * The top-level map is copied and exposed read-only. Nested structures are
 * not copied, and rules never write to them.
 */
public final class Submission {

    private static final Submission EMPTY = new Submission(Collections.emptyMap());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, Object> fields;

    private Submission(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static Submission empty() {
        return EMPTY;
    }

    /**
     * Wraps a copy of the given field map. Null values are kept; a null map yields an empty submission.
     */
    public static Submission of(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new Submission(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    /**
     * Parses a JSON object into a submission. Nested objects become maps and
     * arrays become lists.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Submission fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            Map<String, Object> parsed = MAPPER.readValue(json, MAP_TYPE);
            return of(parsed);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Submission is not a valid JSON object", e);
        }
    }

    public boolean containsKey(String field) {
        return fields.containsKey(field);
    }

    /**
     * @return the value stored under the exact key, or null when absent or null
     */
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    /**
     * @return read-only view of the top-level fields
     */
    public Map<String, Object> asMap() {
        return fields;
    }

    /**
     * Returns the data-store group the caller asked rules to use, carried under a
     * reserved key such as {@code DBGroup}.
     *
     * @param reservedKey name of the reserved field
     * @return the group name, or null when the field is absent or blank
     */
    public String connectionGroup(String reservedKey) {
        Object group = fields.get(reservedKey);
        if (group == null) {
            return null;
        }
        String name = group.toString().trim();
        return name.isEmpty() ? null : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((Submission) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Submission" + fields;
    }
}
