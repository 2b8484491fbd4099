package com.buildpath.adapter.diagnostics;

/**
 * Write-only channel for human-readable progress and error messages.
 * Resolution never changes behavior based on what was written here.
 */
public interface DiagnosticSink {

    void info(String message);

    /**
     * @param cause underlying failure, may be null
     */
    void error(String message, Throwable cause);

    default void error(String message) {
        error(message, null);
    }
}
