/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.ast;

import static java.util.Objects.requireNonNull;

import com.cloudway.lox.scanner.Token;

/**
 * The expression tree. Every composite node owns its operands, the tree
 * is acyclic and nodes are immutable once constructed.
 *
 * <p>Consumers match on the node shape through {@link Visitor}, which has
 * one method per shape, so adding a shape breaks every consumer until it
 * handles the new case.</p>
 */
public abstract class Expr {
    /**
     * Visits the concrete shape of an expression.
     *
     * @param <R> the result type
     */
    public interface Visitor<R> {
        R visitLiteral(Literal expr);
        R visitUnary(Unary expr);
        R visitBinary(Binary expr);
        R visitGrouping(Grouping expr);
    }

    /**
     * A literal value.
     */
    public static final class Literal extends Expr {
        private final Value value;

        Literal(Value value) {
            this.value = requireNonNull(value);
        }

        public Value value() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * A prefix operator applied to a single operand.
     */
    public static final class Unary extends Expr {
        private final Token operator;
        private final Expr right;

        Unary(Token operator, Expr right) {
            this.operator = requireNonNull(operator);
            this.right = requireNonNull(right);
        }

        public Token operator() {
            return operator;
        }

        public Expr right() {
            return right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * An infix operator applied to two operands.
     */
    public static final class Binary extends Expr {
        private final Expr left;
        private final Token operator;
        private final Expr right;

        Binary(Expr left, Token operator, Expr right) {
            this.left = requireNonNull(left);
            this.operator = requireNonNull(operator);
            this.right = requireNonNull(right);
        }

        public Expr left() {
            return left;
        }

        public Token operator() {
            return operator;
        }

        public Expr right() {
            return right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /**
     * A parenthesized expression.
     */
    public static final class Grouping extends Expr {
        private final Expr expression;

        Grouping(Expr expression) {
            this.expression = requireNonNull(expression);
        }

        public Expr expression() {
            return expression;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGrouping(this);
        }
    }

    private Expr() {}

    public static Expr literal(Value value) {
        return new Literal(value);
    }

    public static Expr literal(double value) {
        return new Literal(Value.of(value));
    }

    public static Expr literal(String value) {
        return new Literal(Value.of(value));
    }

    public static Expr literal(boolean value) {
        return new Literal(Value.of(value));
    }

    public static Expr nil() {
        return new Literal(Value.nil());
    }

    public static Expr unary(Token operator, Expr right) {
        return new Unary(operator, right);
    }

    public static Expr binary(Expr left, Token operator, Expr right) {
        return new Binary(left, operator, right);
    }

    public static Expr grouping(Expr expression) {
        return new Grouping(expression);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Returns the canonical parenthesized rendering of this expression.
     *
     * @see AstPrinter
     */
    public String toString() {
        return new AstPrinter().print(this);
    }
}
