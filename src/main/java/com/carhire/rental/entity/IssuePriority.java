package com.carhire.rental.entity;

public enum IssuePriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    /** Next level up; URGENT stays URGENT. */
    public IssuePriority escalate() {
        return this == URGENT ? URGENT : values()[ordinal() + 1];
    }
}
