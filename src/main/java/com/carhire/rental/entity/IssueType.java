package com.carhire.rental.entity;

public enum IssueType {
    VEHICLE_PROBLEM,
    SERVICE_COMPLAINT,
    BILLING_ISSUE,
    BOOKING_PROBLEM,
    ACCIDENT_REPORT,
    BREAKDOWN,
    OTHER
}
