package com.github.dimitryivaniuta.dbgateway.tools;

public class InvalidIdentifierException extends RuntimeException {

    public InvalidIdentifierException(String message) {
        super(message);
    }
}
