package com.carhire.rental.entity;

public enum SafetyEquipmentStatus {
    PRESENT,
    MISSING,
    DAMAGED,
    EXPIRED
}
