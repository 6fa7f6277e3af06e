/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.scanner;

import java.util.Objects;
import static java.util.Objects.requireNonNull;

/**
 * An immutable lexical token.
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Literal literal;
    private final int line;

    /**
     * Construct a token.
     *
     * @param type the lexical category
     * @param lexeme the source text the token was derived from
     * @param literal the decoded payload, {@link Literal#none()} if none
     * @param line the 1-based source line on which the token starts
     */
    public Token(TokenType type, String lexeme, Literal literal, int line) {
        this.type    = requireNonNull(type);
        this.lexeme  = requireNonNull(lexeme);
        this.literal = requireNonNull(literal);
        this.line    = line;
    }

    public TokenType type() {
        return type;
    }

    public String lexeme() {
        return lexeme;
    }

    public Literal literal() {
        return literal;
    }

    public int line() {
        return line;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Token))
            return false;

        Token other = (Token)obj;
        return type == other.type
            && line == other.line
            && lexeme.equals(other.lexeme)
            && literal.equals(other.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme, literal, line);
    }

    public String toString() {
        return "type: '" + type.show() + "', lexeme: '" + lexeme + "', literal: " + literal;
    }
}
