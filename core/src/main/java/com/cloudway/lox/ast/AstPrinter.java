/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.ast;

/**
 * Renders an expression tree in fully parenthesized prefix form, e.g.
 * {@code (* (- 123) (group 45.67))}.
 */
public class AstPrinter implements Expr.Visitor<String> {
    public String print(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitLiteral(Expr.Literal expr) {
        return expr.value().show();
    }

    @Override
    public String visitUnary(Expr.Unary expr) {
        return parenthesize(expr.operator().lexeme(), expr.right());
    }

    @Override
    public String visitBinary(Expr.Binary expr) {
        return parenthesize(expr.operator().lexeme(), expr.left(), expr.right());
    }

    @Override
    public String visitGrouping(Expr.Grouping expr) {
        return parenthesize("group", expr.expression());
    }

    private String parenthesize(String name, Expr... exprs) {
        StringBuilder buf = new StringBuilder();
        buf.append('(').append(name);
        for (Expr expr : exprs) {
            buf.append(' ').append(expr.accept(this));
        }
        return buf.append(')').toString();
    }
}
