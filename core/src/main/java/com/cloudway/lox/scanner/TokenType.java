/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.scanner;

import com.google.common.collect.ImmutableMap;

/**
 * The lexical categories of Lox tokens.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN("LeftParen"), RIGHT_PAREN("RightParen"),
    LEFT_BRACE("LeftBrace"), RIGHT_BRACE("RightBrace"),
    COMMA("Comma"), DOT("Dot"), MINUS("Minus"), PLUS("Plus"),
    SEMICOLON("Semicolon"), SLASH("Slash"), STAR("Star"),

    // One or two character tokens.
    BANG("Bang"), BANG_EQUAL("BangEqual"),
    EQUAL("Equal"), EQUAL_EQUAL("EqualEqual"),
    GREATER("Greater"), GREATER_EQUAL("GreaterEqual"),
    LESS("Less"), LESS_EQUAL("LessEqual"),

    // Literals.
    IDENTIFIER("Identifier"), STRING("String"), NUMBER("Number"),

    // Keywords.
    AND("And"), CLASS("Class"), ELSE("Else"), FALSE("False"),
    FUN("Fun"), FOR("For"), IF("If"), NIL("Nil"), OR("Or"),
    PRINT("Print"), RETURN("Return"), SUPER("Super"), THIS("This"),
    TRUE("True"), VAR("Var"), WHILE("While"),

    EOF("EOF");

    private static final ImmutableMap<String, TokenType> keywords =
        ImmutableMap.<String, TokenType>builder()
            .put("and",    AND)
            .put("class",  CLASS)
            .put("else",   ELSE)
            .put("false",  FALSE)
            .put("for",    FOR)
            .put("fun",    FUN)
            .put("if",     IF)
            .put("nil",    NIL)
            .put("or",     OR)
            .put("print",  PRINT)
            .put("return", RETURN)
            .put("super",  SUPER)
            .put("this",   THIS)
            .put("true",   TRUE)
            .put("var",    VAR)
            .put("while",  WHILE)
            .build();

    private final String name;

    TokenType(String name) {
        this.name = name;
    }

    /**
     * Returns the keyword type for the given word, or {@code null} if the
     * word is not reserved. The match is exact and case-sensitive.
     */
    public static TokenType keyword(String word) {
        return keywords.get(word);
    }

    public boolean isKeyword() {
        return keywords.containsValue(this);
    }

    /**
     * Returns the display name used in token diagnostics.
     */
    public String show() {
        return name;
    }

    public String toString() {
        return name;
    }
}
