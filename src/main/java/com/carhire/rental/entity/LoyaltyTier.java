package com.carhire.rental.entity;

/**
 * Loyalty tiers in ascending order. Thresholds and earn rates live in
 * {@link LoyaltyProgram} rows, not here.
 */
public enum LoyaltyTier {
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM
}
