/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api.model;

import java.util.Objects;

/**
 * Result of looking up a field by dotted path.
 *
 * Three outcomes are kept apart: a found non-null value, a found {@code null},
 * and {@link #NOT_FOUND}. An empty string is an ordinary found value.
 */
public final class PathValue {

    public static final PathValue NOT_FOUND = new PathValue(null, false);

    private static final PathValue FOUND_NULL = new PathValue(null, true);

    private final Object value;
    private final boolean found;

    private PathValue(Object value, boolean found) {
        this.value = value;
        this.found = found;
    }

    public static PathValue found(Object value) {
        return value == null ? FOUND_NULL : new PathValue(value, true);
    }

    public boolean isFound() {
        return found;
    }

    /**
     * @return the value, or null when not found or found as null
     */
    public Object value() {
        return value;
    }

    /**
     * Strict comparison against a candidate value. {@link #NOT_FOUND} equals nothing,
     * not even null.
     */
    public boolean holds(Object candidate) {
        return found && Objects.equals(value, candidate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PathValue that = (PathValue) o;
        return found == that.found && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, found);
    }

    @Override
    public String toString() {
        return found ? "PathValue[" + value + "]" : "PathValue[NOT_FOUND]";
    }
}
