package com.carhire.rental.util;

import com.carhire.rental.entity.AddOnPricingType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Pure rental arithmetic. All money values are rounded HALF_UP to 2 dp.
 *
 * Formulas:
 *   totalDays  = max(1, whole days between pickup and return)
 *   subtotal   = dailyRate × totalDays
 *   total      = subtotal + tax + additionalFees + insurance − discount
 *   weeklyRate = dailyRate × 6.5   (when no explicit rate is set)
 *   monthlyRate= dailyRate × 25
 */
public final class PricingUtil {

    public static final BigDecimal WEEKLY_MULTIPLIER  = new BigDecimal("6.5");
    public static final BigDecimal MONTHLY_MULTIPLIER = new BigDecimal("25");

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private PricingUtil() {}

    /**
     * Whole days between pickup and return, never less than one.
     * A rental shorter than 24 hours still bills as a full day.
     */
    public static int totalDays(LocalDateTime pickup, LocalDateTime dropOff) {
        long days = Duration.between(pickup, dropOff).toDays();
        return (int) Math.max(1, days);
    }

    public static BigDecimal subtotal(BigDecimal dailyRate, int totalDays) {
        return money(dailyRate.multiply(BigDecimal.valueOf(totalDays)));
    }

    /**
     * Line total of one add-on.
     *
     * @param price     unit price, or percentage points for PERCENTAGE add-ons
     * @param quantity  units attached to the booking
     * @param totalDays rental length in days
     * @param subtotal  rental subtotal, the base for PERCENTAGE add-ons
     */
    public static BigDecimal addOnLineTotal(AddOnPricingType pricingType, BigDecimal price,
                                            int quantity, int totalDays, BigDecimal subtotal) {
        BigDecimal qty = BigDecimal.valueOf(quantity);
        switch (pricingType) {
            case PER_DAY:
                return money(price.multiply(qty).multiply(BigDecimal.valueOf(totalDays)));
            case PER_BOOKING:
                return money(price.multiply(qty));
            case PERCENTAGE:
                return money(percentOf(subtotal, price).multiply(qty));
            default:
                throw new IllegalArgumentException("Unknown pricing type: " + pricingType);
        }
    }

    public static BigDecimal total(BigDecimal subtotal, BigDecimal tax, BigDecimal additionalFees,
                                   BigDecimal insurance, BigDecimal discount) {
        return money(subtotal
                .add(nz(tax))
                .add(nz(additionalFees))
                .add(nz(insurance))
                .subtract(nz(discount)));
    }

    public static BigDecimal weeklyRate(BigDecimal dailyRate) {
        return money(dailyRate.multiply(WEEKLY_MULTIPLIER));
    }

    public static BigDecimal monthlyRate(BigDecimal dailyRate) {
        return money(dailyRate.multiply(MONTHLY_MULTIPLIER));
    }

    /** {@code base × percent / 100}, rounded to cents. */
    public static BigDecimal percentOf(BigDecimal base, BigDecimal percent) {
        return money(nz(base).multiply(nz(percent)).divide(HUNDRED, 4, RoundingMode.HALF_UP));
    }

    public static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
