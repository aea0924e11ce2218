package com.carhire.rental.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Booking lifecycle states.
 *
 * <pre>
 * PENDING → CONFIRMED → ACTIVE → COMPLETED
 * PENDING | CONFIRMED → CANCELLED
 * CONFIRMED → NO_SHOW
 * </pre>
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    ACTIVE,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    /** States that hold the vehicle for their date range. */
    public static final Set<BookingStatus> BLOCKING = EnumSet.of(PENDING, CONFIRMED, ACTIVE);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == NO_SHOW;
    }
}
