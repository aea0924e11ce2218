package com.carhire.rental.exception;

/**
 * Bad credentials, or a missing, expired or revoked token. Maps to 401.
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
