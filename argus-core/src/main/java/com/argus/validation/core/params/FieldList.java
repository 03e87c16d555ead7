/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.params;

import java.util.List;

/**
 * Parameter of {@code required_with} / {@code required_without}: the names of the
 * fields the rule depends on, e.g. {@code "password,email"}. Names may be dotted paths.
 */
public record FieldList(List<String> fields) {

    public FieldList {
        fields = List.copyOf(fields);
    }
}
