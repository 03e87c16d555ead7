/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.params;

import java.math.BigDecimal;

/**
 * Decimal parsing for rule values and bounds.
 *
 * Accepts optional sign, fraction and exponent ("-1.5", "+3", ".5", "1e3") with
 * surrounding whitespace. Hex, NaN, infinity and grouping separators are rejected.
 */
public final class NumericText {

    private NumericText() {
    }

    /**
     * @return the parsed number, or null if the text is not numeric
     */
    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    public static boolean isNumeric(String text) {
        return parse(text) != null;
    }
}
