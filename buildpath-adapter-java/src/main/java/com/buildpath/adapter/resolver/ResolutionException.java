package com.buildpath.adapter.resolver;

/**
 * Dependency resolution failed: network trouble, a missing or malformed descriptor,
 * a failing resolver process, or a resolve report with errors.
 */
public class ResolutionException extends Exception {
    public ResolutionException(String message) { super(message); }
    public ResolutionException(String message, Throwable cause) { super(message, cause); }
}
