package com.carhire.rental.entity;

/**
 * Account classification. Anything other than CUSTOMER counts as staff
 * for the admin endpoints.
 */
public enum UserType {
    CUSTOMER,
    STAFF,
    MANAGER,
    ADMIN;

    public boolean isStaff() {
        return this != CUSTOMER;
    }
}
