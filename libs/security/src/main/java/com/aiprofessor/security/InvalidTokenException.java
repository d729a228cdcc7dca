package com.aiprofessor.security;

/**
 * Thrown when a credential is missing, malformed, expired, wrongly signed or of the wrong type.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
