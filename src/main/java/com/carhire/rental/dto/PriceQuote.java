package com.carhire.rental.dto;

import lombok.*;

import java.math.BigDecimal;

/**
 * Price preview for a vehicle and date range; nothing is persisted.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceQuote {

    private Long vehicleId;
    private int totalDays;
    private BigDecimal dailyRate;
    private BigDecimal weeklyRate;
    private BigDecimal monthlyRate;
    private BigDecimal subtotal;
    private BigDecimal taxAmount;
    private BigDecimal totalAmount;
    private BigDecimal securityDeposit;
    private boolean available;
}
