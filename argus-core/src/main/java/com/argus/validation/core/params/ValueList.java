/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.params;

import java.util.List;

/**
 * Parameter of {@code in_list} / {@code not_in_list}. Entries are trimmed at parse time.
 */
public record ValueList(List<String> values) {

    public ValueList {
        values = List.copyOf(values);
    }

    public boolean contains(String value) {
        return value != null && values.contains(value);
    }
}
