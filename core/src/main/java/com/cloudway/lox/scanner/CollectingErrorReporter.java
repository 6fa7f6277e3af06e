/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.scanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * An error reporter that records diagnostics in the order they were reported.
 */
public class CollectingErrorReporter implements ErrorReporter {
    /**
     * A recorded diagnostic.
     */
    public static final class Diagnostic {
        private final int line;
        private final String where;
        private final String message;

        public Diagnostic(int line, String where, String message) {
            this.line = line;
            this.where = where;
            this.message = message;
        }

        public int line() {
            return line;
        }

        public String where() {
            return where;
        }

        public String message() {
            return message;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Diagnostic))
                return false;
            Diagnostic other = (Diagnostic)obj;
            return line == other.line
                && Objects.equals(where, other.where)
                && Objects.equals(message, other.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(line, where, message);
        }

        public String toString() {
            return "[line " + line + "] Error(" + where + "): " + message;
        }
    }

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void report(int line, String where, String message) {
        diagnostics.add(new Diagnostic(line, where, message));
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns a snapshot of the diagnostics reported so far.
     */
    public List<Diagnostic> getDiagnostics() {
        return ImmutableList.copyOf(diagnostics);
    }
}
