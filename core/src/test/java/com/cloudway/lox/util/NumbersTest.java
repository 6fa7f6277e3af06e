/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.util;

import org.junit.Test;
import static org.junit.Assert.*;

public class NumbersTest {
    @Test
    public void format() {
        assertEquals("123", Numbers.format(123.0));
        assertEquals("45.67", Numbers.format(45.67));
        assertEquals("123.456", Numbers.format(123.456));
        assertEquals("0.1", Numbers.format(0.1));
        assertEquals("0", Numbers.format(0.0));
        assertEquals("-0", Numbers.format(-0.0));
        assertEquals("-2.5", Numbers.format(-2.5));
    }

    @Test
    public void noExponent() {
        assertEquals("1000000000000000000000", Numbers.format(1e21));
        assertEquals("0.00000015", Numbers.format(1.5e-7));
    }
}
