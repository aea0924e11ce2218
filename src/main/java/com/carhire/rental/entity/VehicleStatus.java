package com.carhire.rental.entity;

public enum VehicleStatus {
    AVAILABLE,
    RENTED,
    MAINTENANCE,
    REPAIR,
    RETIRED,
    SOLD
}
