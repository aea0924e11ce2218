package com.carhire.rental.entity;

public enum AddOnType {
    GPS,
    CHILD_SEAT,
    ADDITIONAL_DRIVER,
    WIFI,
    SKI_RACK,
    BIKE_RACK,
    ROADSIDE_ASSISTANCE,
    FUEL_SERVICE,
    CLEANING,
    DELIVERY,
    OTHER
}
