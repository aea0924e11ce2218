package com.carhire.rental.exception;

/**
 * A generated reference collided with an existing one on every attempt.
 * Retryable by the client. Maps to 409.
 */
public class DuplicateIdentifierException extends RuntimeException {

    public DuplicateIdentifierException(String message) {
        super(message);
    }
}
