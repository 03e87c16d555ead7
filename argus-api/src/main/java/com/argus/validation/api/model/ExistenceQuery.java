/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.api.model;

import java.util.Objects;

/**
 * One "does a matching row exist" question for an {@link com.argus.validation.api.ExistenceStore}.
 * Built fresh for each rule invocation.
 *
 * @param table           table to search
 * @param column          column compared against {@code value}
 * @param value           value under test, may be null
 * @param filter          optional second condition, never null
 * @param connectionGroup data-store group to query, null for the default group
 */
public record ExistenceQuery(
        String table,
        String column,
        String value,
        RowFilter filter,
        String connectionGroup
) {

    public ExistenceQuery {
        Objects.requireNonNull(table, "table cannot be null");
        Objects.requireNonNull(column, "column cannot be null");
        if (filter == null) {
            filter = RowFilter.none();
        }
    }

    /**
     * Query against the default group with no row filter.
     */
    public ExistenceQuery(String table, String column, String value) {
        this(table, column, value, RowFilter.none(), null);
    }
}
