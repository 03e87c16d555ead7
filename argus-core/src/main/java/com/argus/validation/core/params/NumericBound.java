/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.params;

import java.math.BigDecimal;

/**
 * Parameter of the range and length-bound rules. A non-numeric parameter yields
 * {@link #NOT_NUMERIC}, which makes every comparison fail.
 */
public record NumericBound(BigDecimal value) {

    public static final NumericBound NOT_NUMERIC = new NumericBound(null);

    public boolean isNumeric() {
        return value != null;
    }

    /**
     * @return sign of {@code candidate - bound}, or null when either side is not numeric
     */
    public Integer compare(BigDecimal candidate) {
        if (value == null || candidate == null) {
            return null;
        }
        return candidate.compareTo(value);
    }
}
