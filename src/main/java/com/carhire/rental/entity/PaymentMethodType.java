package com.carhire.rental.entity;

public enum PaymentMethodType {
    CREDIT_CARD,
    DEBIT_CARD,
    BANK_TRANSFER,
    PAYPAL,
    CASH,
    CHECK,
    MOBILE_PAYMENT,
    CRYPTOCURRENCY
}
