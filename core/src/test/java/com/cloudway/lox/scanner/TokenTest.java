/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.scanner;

import java.util.NoSuchElementException;

import org.junit.Test;
import static org.junit.Assert.*;

import static com.cloudway.lox.scanner.TokenType.*;

public class TokenTest {
    @Test
    public void render() {
        assertEquals("type: 'LeftParen', lexeme: '(', literal: None",
                     new Token(LEFT_PAREN, "(", Literal.none(), 1).toString());
        assertEquals("type: 'String', lexeme: 'hi there', literal: 'hi there'",
                     new Token(STRING, "hi there", Literal.of("hi there"), 1).toString());
        assertEquals("type: 'Number', lexeme: '123.456', literal: '123.456'",
                     new Token(NUMBER, "123.456", Literal.of(123.456), 1).toString());
        assertEquals("type: 'Number', lexeme: '7', literal: '7'",
                     new Token(NUMBER, "7", Literal.of(7), 1).toString());
        assertEquals("type: 'EOF', lexeme: '', literal: None",
                     new Token(EOF, "", Literal.none(), 4).toString());
    }

    @Test
    public void equality() {
        Token t = new Token(IDENTIFIER, "x", Literal.of("x"), 2);

        assertEquals(t, new Token(IDENTIFIER, "x", Literal.of("x"), 2));
        assertEquals(t.hashCode(), new Token(IDENTIFIER, "x", Literal.of("x"), 2).hashCode());

        assertNotEquals(t, new Token(IDENTIFIER, "x", Literal.of("x"), 3));
        assertNotEquals(t, new Token(IDENTIFIER, "y", Literal.of("x"), 2));
        assertNotEquals(t, new Token(IDENTIFIER, "x", Literal.none(), 2));
        assertNotEquals(t, new Token(STRING, "x", Literal.of("x"), 2));
    }

    @Test
    public void literalVariants() {
        assertEquals(Literal.of(1.5), Literal.of(1.5));
        assertNotEquals(Literal.of("1"), Literal.of(1));
        assertNotEquals(Literal.none(), Literal.of(""));
        assertSame(Literal.none(), Literal.none());

        assertTrue(Literal.of("s").isString());
        assertTrue(Literal.of(2).isNumber());
        assertTrue(Literal.none().isNone());

        assertEquals("str", Literal.of("x").fold(s -> "str", n -> "num", () -> "none"));
        assertEquals("num", Literal.of(1).fold(s -> "str", n -> "num", () -> "none"));
        assertEquals("none", Literal.none().fold(s -> "str", n -> "num", () -> "none"));
    }

    @Test(expected = NoSuchElementException.class)
    public void noStringPayload() {
        Literal.of(3).stringValue();
    }

    @Test(expected = NoSuchElementException.class)
    public void noNumberPayload() {
        Literal.none().numberValue();
    }

    @Test
    public void keywords() {
        assertEquals(WHILE, TokenType.keyword("while"));
        assertEquals(NIL, TokenType.keyword("nil"));
        assertNull(TokenType.keyword("While"));
        assertNull(TokenType.keyword("whiletrue"));

        assertTrue(CLASS.isKeyword());
        assertFalse(IDENTIFIER.isKeyword());
        assertFalse(EOF.isKeyword());
    }
}
