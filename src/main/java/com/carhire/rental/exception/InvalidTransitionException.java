package com.carhire.rental.exception;

/**
 * A status change was requested from a state that does not allow it. Maps to 409.
 */
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    public InvalidTransitionException(String entity, Object from, String action) {
        super("Cannot " + action + " " + entity + " in status " + from);
    }
}
