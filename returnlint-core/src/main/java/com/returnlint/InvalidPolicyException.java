package com.returnlint;

/**
 * Exception thrown when a return-style policy cannot be built from its configuration.
 */
public class InvalidPolicyException extends RuntimeException {

    public InvalidPolicyException(String message) {
        super(message);
    }

    public InvalidPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
