package com.carhire.rental.entity;

public enum PaymentType {
    BOOKING_PAYMENT,
    SECURITY_DEPOSIT,
    ADDITIONAL_CHARGES,
    PENALTY
}
