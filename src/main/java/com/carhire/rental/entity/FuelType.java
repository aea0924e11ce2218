package com.carhire.rental.entity;

public enum FuelType {
    PETROL,
    DIESEL,
    HYBRID,
    ELECTRIC
}
