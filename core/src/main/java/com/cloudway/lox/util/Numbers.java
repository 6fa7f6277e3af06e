/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.util;

import java.math.BigDecimal;

/**
 * Number formatting shared by token and expression rendering.
 */
public final class Numbers {
    private Numbers() {}

    /**
     * Returns the shortest decimal text that reads back as the given value.
     * Integral values print without a fractional part and the result never
     * uses exponent notation, e.g. {@code 123.0} prints as {@code 123} and
     * {@code 45.67} as {@code 45.67}.
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0) {
            // keeps the sign of negative zero
            return (1 / value < 0) ? "-0" : "0";
        }
        return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }
}
