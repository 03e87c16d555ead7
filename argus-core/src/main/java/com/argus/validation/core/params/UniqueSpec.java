/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.params;

import com.argus.validation.api.model.RowFilter;

import java.util.Objects;

/**
 * Parameter of {@code is_unique} / {@code is_not_unique}:
 * {@code table.column[,filterColumn,filterValue]}.
 *
 * The filter pair is either both present or both null. A blank pair or a
 * placeholder value such as {@code {id}} parses to "no filter".
 */
public record UniqueSpec(String table, String column, String filterColumn, String filterValue) {

    public UniqueSpec {
        Objects.requireNonNull(table, "table cannot be null");
        Objects.requireNonNull(column, "column cannot be null");
        if (filterColumn == null || filterValue == null) {
            filterColumn = null;
            filterValue = null;
        }
    }

    public boolean hasFilter() {
        return filterColumn != null;
    }

    /**
     * Filter for {@code is_unique}: rows matching the pair are ignored.
     */
    public RowFilter exclusion() {
        return hasFilter() ? RowFilter.excluding(filterColumn, filterValue) : RowFilter.none();
    }

    /**
     * Filter for {@code is_not_unique}: only rows matching the pair count.
     */
    public RowFilter requirement() {
        return hasFilter() ? RowFilter.requiring(filterColumn, filterValue) : RowFilter.none();
    }
}
