package com.carhire.rental.entity;

/**
 * <pre>
 * PENDING → PROCESSING → COMPLETED → REFUNDED | PARTIALLY_REFUNDED
 * PENDING | PROCESSING → FAILED | CANCELLED
 * </pre>
 */
public enum PaymentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED,
    REFUNDED,
    PARTIALLY_REFUNDED
}
