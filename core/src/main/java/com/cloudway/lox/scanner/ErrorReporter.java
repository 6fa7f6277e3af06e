/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.scanner;

/**
 * The sink that receives lexical diagnostics. The scanner reports each
 * problem once and carries on scanning; what happens to the report is up
 * to the implementation.
 */
@FunctionalInterface
public interface ErrorReporter {
    /**
     * Report a problem at the given location.
     *
     * @param line the 1-based source line
     * @param where the location within the line, may be empty
     * @param message the diagnostic message
     */
    void report(int line, String where, String message);

    /**
     * Report a problem with no location within the line.
     */
    default void error(int line, String message) {
        report(line, "", message);
    }
}
