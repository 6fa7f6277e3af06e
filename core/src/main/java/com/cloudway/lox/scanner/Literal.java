/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.scanner;

import java.util.NoSuchElementException;
import java.util.function.DoubleFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import static java.util.Objects.requireNonNull;

import com.cloudway.lox.util.Numbers;

/**
 * The {@code Literal} class represents the decoded payload carried by a
 * token: a string, a number, or no literal at all. Punctuation, operators,
 * keywords and the end-of-input marker carry {@link #none()}.
 */
public abstract class Literal {
    private static final class Str extends Literal {
        private final String value;

        Str(String value) {
            this.value = value;
        }

        @Override
        public boolean isString() {
            return true;
        }

        @Override
        public String stringValue() {
            return value;
        }

        @Override
        public <R> R fold(Function<? super String, ? extends R> ifString,
                          DoubleFunction<? extends R> ifNumber,
                          Supplier<? extends R> ifNone) {
            return ifString.apply(value);
        }
    }

    private static final class Num extends Literal {
        private final double value;

        Num(double value) {
            this.value = value;
        }

        @Override
        public boolean isNumber() {
            return true;
        }

        @Override
        public double numberValue() {
            return value;
        }

        @Override
        public <R> R fold(Function<? super String, ? extends R> ifString,
                          DoubleFunction<? extends R> ifNumber,
                          Supplier<? extends R> ifNone) {
            return ifNumber.apply(value);
        }
    }

    private static final class None extends Literal {
        @Override
        public <R> R fold(Function<? super String, ? extends R> ifString,
                          DoubleFunction<? extends R> ifNumber,
                          Supplier<? extends R> ifNone) {
            return ifNone.get();
        }
    }

    private static final Literal NONE = new None();

    private Literal() {}

    /**
     * Construct a string literal.
     */
    public static Literal of(String value) {
        return new Str(requireNonNull(value));
    }

    /**
     * Construct a numeric literal.
     */
    public static Literal of(double value) {
        return new Num(value);
    }

    /**
     * Returns the literal used by tokens that carry no value.
     */
    public static Literal none() {
        return NONE;
    }

    public boolean isString() {
        return false;
    }

    public boolean isNumber() {
        return false;
    }

    public boolean isNone() {
        return this == NONE;
    }

    /**
     * Returns the string payload.
     *
     * @throws NoSuchElementException if this is not a string literal
     */
    public String stringValue() {
        throw new NoSuchElementException("not a string literal");
    }

    /**
     * Returns the numeric payload.
     *
     * @throws NoSuchElementException if this is not a numeric literal
     */
    public double numberValue() {
        throw new NoSuchElementException("not a numeric literal");
    }

    /**
     * Apply the function that matches the variant of this literal.
     *
     * @param ifString applied to the string payload
     * @param ifNumber applied to the numeric payload
     * @param ifNone supplies the result when there is no payload
     */
    public abstract <R> R fold(Function<? super String, ? extends R> ifString,
                               DoubleFunction<? extends R> ifNumber,
                               Supplier<? extends R> ifNone);

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Literal))
            return false;

        Literal other = (Literal)obj;
        return fold(s -> other.isString() && s.equals(other.stringValue()),
                    n -> other.isNumber() && Double.compare(n, other.numberValue()) == 0,
                    other::isNone);
    }

    @Override
    public int hashCode() {
        return fold(String::hashCode, Double::hashCode, () -> 0);
    }

    /**
     * Renders the literal for token diagnostics. Strings and numbers are
     * quoted, numbers in their shortest decimal form ({@code '123.456'}),
     * and no literal prints as {@code None}.
     */
    public String toString() {
        return fold(s -> "'" + s + "'", n -> "'" + Numbers.format(n) + "'", () -> "None");
    }
}
