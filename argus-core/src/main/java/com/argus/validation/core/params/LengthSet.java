/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.params;

import java.math.BigDecimal;
import java.util.List;

/**
 * Parameter of {@code exact_length}: acceptable lengths, e.g. {@code "5,8,12"}.
 * Non-numeric entries are dropped at parse time.
 */
public record LengthSet(List<BigDecimal> lengths) {

    public LengthSet {
        lengths = List.copyOf(lengths);
    }

    public boolean accepts(int length) {
        BigDecimal actual = BigDecimal.valueOf(length);
        for (BigDecimal candidate : lengths) {
            if (candidate.compareTo(actual) == 0) {
                return true;
            }
        }
        return false;
    }
}
