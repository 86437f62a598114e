package com.hinata.backend.modules.auth.application.token;

/**
 * Any reason a token cannot be trusted: bad signature, malformed payload, expired, unknown subject.
 * Callers must not reveal which one to the client.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
