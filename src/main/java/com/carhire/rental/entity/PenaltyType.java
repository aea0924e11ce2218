package com.carhire.rental.entity;

public enum PenaltyType {
    LATE_RETURN,
    FUEL_SHORTAGE,
    DAMAGE,
    CLEANING_FEE,
    SMOKING_FEE,
    MILEAGE_OVERAGE,
    TRAFFIC_VIOLATION,
    LOST_KEY,
    OTHER
}
