package com.carhire.rental.exception;

/**
 * A user-supplied unique value (username, email, licence plate, promotion
 * code, ...) is already taken. Maps to 400.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }
}
