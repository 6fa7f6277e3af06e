/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.scanner;

import java.io.PrintStream;
import java.io.PrintWriter;
import static java.util.Objects.requireNonNull;

/**
 * An error reporter that prints diagnostics in the form
 * {@code [line N] Error(where): message}.
 */
public class ConsoleErrorReporter implements ErrorReporter {
    private final PrintWriter out;
    private int errors;

    /**
     * Construct a reporter that writes to standard error.
     */
    public ConsoleErrorReporter() {
        this(System.err);
    }

    public ConsoleErrorReporter(PrintStream out) {
        this(new PrintWriter(requireNonNull(out), true));
    }

    public ConsoleErrorReporter(PrintWriter out) {
        this.out = requireNonNull(out);
    }

    @Override
    public void report(int line, String where, String message) {
        out.println("[line " + line + "] Error(" + where + "): " + message);
        out.flush();
        errors++;
    }

    /**
     * Returns true if any error was reported since the last reset.
     */
    public boolean hadError() {
        return errors != 0;
    }

    public int getErrorCount() {
        return errors;
    }

    /**
     * Forget previously reported errors.
     */
    public void reset() {
        errors = 0;
    }
}
