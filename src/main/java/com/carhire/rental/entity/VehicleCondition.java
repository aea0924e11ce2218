package com.carhire.rental.entity;

public enum VehicleCondition {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR
}
