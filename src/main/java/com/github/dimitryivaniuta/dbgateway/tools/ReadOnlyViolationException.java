package com.github.dimitryivaniuta.dbgateway.tools;

/**
 * Statement rejected by the query tool: not a single read-only statement.
 */
public class ReadOnlyViolationException extends RuntimeException {

    public ReadOnlyViolationException(String message) {
        super(message);
    }
}
