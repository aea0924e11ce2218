package com.carhire.rental.entity;

/**
 * Payment progress of a booking, derived from its payments.
 */
public enum BookingPaymentStatus {
    PENDING,
    PARTIAL,
    PAID,
    REFUNDED,
    FAILED
}
