package com.carhire.rental.exception;

/**
 * Well-formed request rejected by a business rule. Maps to 400.
 */
public class BusinessRuleException extends RuntimeException {

    public BusinessRuleException(String message) {
        super(message);
    }
}
