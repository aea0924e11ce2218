package com.carhire.rental.entity;

public enum PenaltyStatus {
    PENDING,
    DISPUTED,
    APPROVED,
    PAID,
    WAIVED
}
