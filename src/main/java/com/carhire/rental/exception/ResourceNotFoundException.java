package com.carhire.rental.exception;

/**
 * A referenced row (booking, vehicle, payment, ...) does not exist. Maps to 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
