package com.carhire.rental.exception;

/**
 * Authenticated caller lacks the role or ownership the operation needs. Maps to 403.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
