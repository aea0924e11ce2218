package com.carhire.rental.entity;

public enum TransmissionType {
    MANUAL,
    AUTOMATIC
}
