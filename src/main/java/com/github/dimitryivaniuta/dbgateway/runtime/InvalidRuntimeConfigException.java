package com.github.dimitryivaniuta.dbgateway.runtime;

/**
 * A runtime configuration candidate failed validation. The active snapshot is kept.
 */
public class InvalidRuntimeConfigException extends RuntimeException {

    public InvalidRuntimeConfigException(String message) {
        super(message);
    }

    public InvalidRuntimeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
