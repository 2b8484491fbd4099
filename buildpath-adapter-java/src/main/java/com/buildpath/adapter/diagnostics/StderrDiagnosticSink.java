package com.buildpath.adapter.diagnostics;

import java.io.PrintStream;

/**
 * Prefixed lines on stderr. Stdout is left alone so it can carry the JSON result.
 */
public class StderrDiagnosticSink implements DiagnosticSink {

    private static final String PREFIX = "[buildpath] ";

    private final PrintStream err;

    public StderrDiagnosticSink() {
        this(System.err);
    }

    public StderrDiagnosticSink(PrintStream err) {
        this.err = err;
    }

    @Override
    public void info(String message) {
        err.println(PREFIX + message);
    }

    @Override
    public void error(String message, Throwable cause) {
        err.println(PREFIX + "ERROR: " + message);
        if (cause != null) {
            cause.printStackTrace(err);
        }
    }
}
