/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lox.shell;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.io.LineProcessor;
import com.google.common.io.MoreFiles;
import jline.ConsoleReader;

import com.cloudway.lox.scanner.ConsoleErrorReporter;
import com.cloudway.lox.scanner.Scanner;
import com.cloudway.lox.scanner.Token;

/**
 * The command line driver. Source is fed to the scanner one line at a time
 * and the resulting tokens are printed.
 */
public class Lox {
    private static final Logger logger = Logger.getLogger(Lox.class.getName());

    // sysexits(3) status codes
    public static final int EX_OK       = 0;
    public static final int EX_USAGE    = 64;
    public static final int EX_DATAERR  = 65;
    public static final int EX_NOINPUT  = 66;
    public static final int EX_IOERR    = 74;

    private final ShellConfig config;
    private final PrintStream out;
    private final PrintStream err;
    private final ConsoleErrorReporter reporter;

    public Lox(ShellConfig config, PrintStream out, PrintStream err) {
        this.config = requireNonNull(config);
        this.out = requireNonNull(out);
        this.err = requireNonNull(err);
        this.reporter = new ConsoleErrorReporter(err);
    }

    /**
     * Scans a single chunk of source and prints its tokens.
     *
     * @return the scanned tokens
     */
    public List<Token> run(String source) {
        List<Token> tokens = new Scanner(source, reporter).scanTokens();
        for (Token token : tokens) {
            out.println(token);
        }
        return tokens;
    }

    /**
     * Scans a script line by line.
     *
     * @return the exit status
     */
    public int runFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            err.println("File does not exist");
            return EX_NOINPUT;
        }

        logger.fine("Running script " + path);
        reporter.reset();
        MoreFiles.asCharSource(path, config.getCharset())
            .readLines(new LineProcessor<Void>() {
                @Override
                public boolean processLine(String line) {
                    run(line);
                    return true;
                }

                @Override
                public Void getResult() {
                    return null;
                }
            });
        return reporter.hadError() ? EX_DATAERR : EX_OK;
    }

    /**
     * Runs an interactive session until an empty line or end of input.
     * Errors on one line do not end the session.
     */
    public void runPrompt(InputStream in) throws IOException {
        ConsoleReader console = new ConsoleReader(in, new PrintWriter(out));

        String line;
        while ((line = console.readLine(config.getPrompt())) != null) {
            if (line.isEmpty())
                break;
            run(line);
            reporter.reset();
        }
    }

    public boolean hadError() {
        return reporter.hadError();
    }

    public static void main(String[] args) {
        Lox lox = new Lox(ShellConfig.getDefault(), System.out, System.err);
        int status;

        try {
            if (args.length > 1) {
                System.err.println("Usage: lox [script]");
                status = EX_USAGE;
            } else if (args.length == 1) {
                status = lox.runFile(Paths.get(args[0]));
            } else {
                lox.runPrompt(System.in);
                status = EX_OK;
            }
        } catch (IOException ex) {
            logger.log(Level.SEVERE, "I/O error", ex);
            status = EX_IOERR;
        }

        System.exit(status);
    }
}
