package com.carhire.rental.entity;

public enum DiscountType {
    PERCENTAGE,
    FIXED_AMOUNT,
    FREE_DAYS
}
