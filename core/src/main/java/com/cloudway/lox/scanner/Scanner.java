/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.scanner;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

import static com.cloudway.lox.scanner.TokenType.*;

/**
 * A single pass scanner that translates Lox source text into tokens.
 *
 * <p>Lexical errors never abort the scan. Each problem is reported once to
 * the {@link ErrorReporter} with the current line and the offending input
 * is skipped. The token list always ends with exactly one {@link TokenType#EOF}
 * token.</p>
 *
 * <p>A scanner instance is not thread safe. Independent sources may be
 * scanned concurrently with separate instances.</p>
 */
public class Scanner {
    private static final Logger logger = Logger.getLogger(Scanner.class.getName());

    private static final int EOI = '\0';

    private final String source;
    private final ErrorReporter reporter;
    private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    private List<Token> result;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int startLine = 1;
    private int errors = 0;

    public Scanner(String source, ErrorReporter reporter) {
        this.source = requireNonNull(source);
        this.reporter = requireNonNull(reporter);
    }

    /**
     * Scans the whole source. The scan runs only once, subsequent calls
     * return the same list.
     *
     * @return the immutable list of scanned tokens, terminated by an
     * end-of-input token
     */
    public List<Token> scanTokens() {
        if (result != null) {
            return result;
        }

        while (!isAtEnd()) {
            // We are at the beginning of the next lexeme.
            start = current;
            startLine = line;
            scanToken();
        }

        tokens.add(new Token(EOF, "", Literal.none(), line));
        result = tokens.build();

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Scanned " + result.size() + " tokens over " + line +
                        " lines with " + errors + " errors");
        }
        return result;
    }

    private void scanToken() {
        int c = advance();
        switch (c) {
        case '\n':
            line++;
            break;

        case ' ': case '\r': case '\t':
            break;

        case '(': addToken(LEFT_PAREN); break;
        case ')': addToken(RIGHT_PAREN); break;
        case '{': addToken(LEFT_BRACE); break;
        case '}': addToken(RIGHT_BRACE); break;
        case ',': addToken(COMMA); break;
        case '.': addToken(DOT); break;
        case '-': addToken(MINUS); break;
        case '+': addToken(PLUS); break;
        case ';': addToken(SEMICOLON); break;
        case '*': addToken(STAR); break;

        case '!': addToken(match('=') ? BANG_EQUAL : BANG); break;
        case '=': addToken(match('=') ? EQUAL_EQUAL : EQUAL); break;
        case '<': addToken(match('=') ? LESS_EQUAL : LESS); break;
        case '>': addToken(match('=') ? GREATER_EQUAL : GREATER); break;

        case '/':
            if (match('/')) {
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd())
                    advance();
            } else if (match('*')) {
                blockComment();
            } else {
                addToken(SLASH);
            }
            break;

        case '"':
            string();
            break;

        default:
            if (isDigit(c)) {
                number();
            } else if (isIdentifierStart(c)) {
                identifier();
            } else {
                error("Unexpected character: " + new StringBuilder().appendCodePoint(c));
            }
            break;
        }
    }

    /*
     * Block comments do not nest: the first "*\/" closes the comment.
     * An unterminated block comment swallows the rest of the input
     * without a diagnostic.
     */
    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                current += 2;
                return;
            }
            if (advance() == '\n') {
                line++;
            }
        }
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n')
                line++;
            advance();
        }

        if (isAtEnd()) {
            error("Unterminated string.");
            return;
        }

        // The closing ".
        advance();

        // Trim the surrounding quotes from both the lexeme and the value.
        String value = source.substring(start + 1, current - 1);
        tokens.add(new Token(STRING, value, Literal.of(value), startLine));
    }

    private void number() {
        while (isDigit(peek()))
            advance();

        // Look for a fractional part.
        if (peek() == '.' && isDigit(peekNext())) {
            // Consume the "."
            advance();

            while (isDigit(peek()))
                advance();
        }

        String text = source.substring(start, current);
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            error("Unable to parse number: " + ex.getMessage());
            return;
        }
        addToken(NUMBER, Literal.of(value));
    }

    private void identifier() {
        while (isIdentifierPart(peek()))
            advance();

        String text = source.substring(start, current);
        TokenType type = TokenType.keyword(text);
        if (type == null) {
            addToken(IDENTIFIER, Literal.of(text));
        } else {
            addToken(type);
        }
    }

    private boolean match(char expected) {
        if (isAtEnd())
            return false;
        if (source.charAt(current) != expected)
            return false;

        current++;
        return true;
    }

    private int peek() {
        return isAtEnd() ? EOI : source.codePointAt(current);
    }

    private int peekNext() {
        if (isAtEnd())
            return EOI;
        int next = current + Character.charCount(source.codePointAt(current));
        return next >= source.length() ? EOI : source.codePointAt(next);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(int c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    // Source is consumed by code point, a supplementary character is one unit.
    private int advance() {
        int c = source.codePointAt(current);
        current += Character.charCount(c);
        return c;
    }

    private void addToken(TokenType type) {
        addToken(type, Literal.none());
    }

    private void addToken(TokenType type, Literal literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine));
    }

    private void error(String message) {
        errors++;
        reporter.error(line, message);
    }
}
