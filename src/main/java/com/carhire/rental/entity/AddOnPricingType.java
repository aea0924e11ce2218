package com.carhire.rental.entity;

/**
 * How an add-on's price applies: per rental day, once per booking, or as
 * a percentage of the booking subtotal.
 */
public enum AddOnPricingType {
    PER_DAY,
    PER_BOOKING,
    PERCENTAGE
}
