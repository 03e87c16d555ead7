/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api.model;

import java.util.Objects;

/**
 * Optional second condition on an existence query.
 *
 * <ul>
 *   <li>{@link NoFilter}: match on the main column only</li>
 *   <li>{@link Excluding}: ignore rows where {@code column == value} (record updates)</li>
 *   <li>{@link Requiring}: only count rows where {@code column == value}</li>
 * </ul>
 *
 * Unresolved placeholders such as {@code {id}} never reach this type; the
 * parameter parser turns them into {@link #none()}.
 */
public sealed interface RowFilter permits RowFilter.NoFilter, RowFilter.Excluding, RowFilter.Requiring {

    static RowFilter none() {
        return NoFilter.INSTANCE;
    }

    static RowFilter excluding(String column, String value) {
        return new Excluding(column, value);
    }

    static RowFilter requiring(String column, String value) {
        return new Requiring(column, value);
    }

    final class NoFilter implements RowFilter {
        private static final NoFilter INSTANCE = new NoFilter();

        private NoFilter() {
        }

        @Override
        public String toString() {
            return "NoFilter";
        }
    }

    record Excluding(String column, String value) implements RowFilter {
        public Excluding {
            Objects.requireNonNull(column, "column cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    record Requiring(String column, String value) implements RowFilter {
        public Requiring {
            Objects.requireNonNull(column, "column cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }
    }
}
