/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.ast;

import static java.util.Objects.requireNonNull;

import com.cloudway.lox.util.Numbers;

/**
 * The value held by a literal expression: {@code nil}, a boolean, a number
 * or a string.
 */
public abstract class Value {
    /**
     * The cases of a {@code Value}. Every consumer that matches on a value
     * must handle all of them.
     */
    public interface Cases<R> {
        R nil();
        R bool(boolean value);
        R number(double value);
        R string(String value);
    }

    private static final Value NIL = new Value() {
        @Override
        public <R> R match(Cases<R> cases) {
            return cases.nil();
        }
    };

    private static final Value TRUE = new Bool(true);
    private static final Value FALSE = new Bool(false);

    private static final class Bool extends Value {
        private final boolean value;

        Bool(boolean value) {
            this.value = value;
        }

        @Override
        public <R> R match(Cases<R> cases) {
            return cases.bool(value);
        }
    }

    private static final class Num extends Value {
        private final double value;

        Num(double value) {
            this.value = value;
        }

        @Override
        public <R> R match(Cases<R> cases) {
            return cases.number(value);
        }
    }

    private static final class Str extends Value {
        private final String value;

        Str(String value) {
            this.value = value;
        }

        @Override
        public <R> R match(Cases<R> cases) {
            return cases.string(value);
        }
    }

    private Value() {}

    public static Value nil() {
        return NIL;
    }

    public static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Value of(double value) {
        return new Num(value);
    }

    public static Value of(String value) {
        return new Str(requireNonNull(value));
    }

    public abstract <R> R match(Cases<R> cases);

    /**
     * Returns the textual form of the value: {@code nil}, {@code true} or
     * {@code false}, the number's shortest decimal form, or the raw string
     * contents without quotes.
     */
    public String show() {
        return match(new Cases<String>() {
            @Override
            public String nil() {
                return "nil";
            }

            @Override
            public String bool(boolean value) {
                return String.valueOf(value);
            }

            @Override
            public String number(double value) {
                return Numbers.format(value);
            }

            @Override
            public String string(String value) {
                return value;
            }
        });
    }

    public String toString() {
        return show();
    }
}
