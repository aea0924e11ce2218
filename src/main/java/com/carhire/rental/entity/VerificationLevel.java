package com.carhire.rental.entity;

public enum VerificationLevel {
    NONE,
    PENDING,
    VERIFIED
}
