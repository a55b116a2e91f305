package com.linearprogramming;

/**
 * Raised when a problem is malformed or handed to an engine that cannot
 * solve its shape. This is the only failure that crosses the solve boundary;
 * unbounded and infeasible problems are reported through {@link Result}.
 */
public class ValidationException extends IllegalArgumentException {

    private final String reason;

    public ValidationException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public String reason() { return reason; }
}
