package com.carhire.rental.util;

import com.carhire.rental.entity.AddOnPricingType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class PricingUtilTest {

    private static final LocalDateTime PICKUP = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Test
    @DisplayName("Rental shorter than a day bills as one day")
    void totalDays_underOneDay_isOne() {
        assertThat(PricingUtil.totalDays(PICKUP, PICKUP.plusHours(5))).isEqualTo(1);
    }

    @Test
    @DisplayName("Return at the pickup instant still bills one day")
    void totalDays_sameInstant_isOne() {
        assertThat(PricingUtil.totalDays(PICKUP, PICKUP)).isEqualTo(1);
    }

    @Test
    @DisplayName("Partial days are truncated to whole days")
    void totalDays_truncatesPartialDay() {
        assertThat(PricingUtil.totalDays(PICKUP, PICKUP.plusDays(3).plusHours(23))).isEqualTo(3);
    }

    @Test
    @DisplayName("Subtotal is the daily rate times the day count")
    void subtotal_isRateTimesDays() {
        assertThat(PricingUtil.subtotal(new BigDecimal("45.50"), 3)).isEqualByComparingTo("136.50");
    }

    @Test
    @DisplayName("Total adds tax, fees and insurance, then subtracts the discount")
    void total_combinesAllComponents() {
        BigDecimal total = PricingUtil.total(
                new BigDecimal("300.00"), new BigDecimal("45.00"),
                new BigDecimal("20.00"), new BigDecimal("30.00"), new BigDecimal("50.00"));

        assertThat(total).isEqualByComparingTo("345.00");
        assertThat(total.scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Missing components count as zero")
    void total_treatsNullComponentsAsZero() {
        assertThat(PricingUtil.total(new BigDecimal("100"), null, null, null, null))
                .isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("Per-day add-on scales with quantity and days")
    void addOnLineTotal_perDay_multipliesByQuantityAndDays() {
        assertThat(PricingUtil.addOnLineTotal(AddOnPricingType.PER_DAY,
                new BigDecimal("5.00"), 2, 4, new BigDecimal("400.00")))
                .isEqualByComparingTo("40.00");
    }

    @Test
    @DisplayName("Per-booking add-on is charged once")
    void addOnLineTotal_perBooking_ignoresDays() {
        assertThat(PricingUtil.addOnLineTotal(AddOnPricingType.PER_BOOKING,
                new BigDecimal("15.00"), 1, 10, new BigDecimal("400.00")))
                .isEqualByComparingTo("15.00");
    }

    @Test
    @DisplayName("Percentage add-on is a share of the subtotal")
    void addOnLineTotal_percentage_isShareOfSubtotal() {
        assertThat(PricingUtil.addOnLineTotal(AddOnPricingType.PERCENTAGE,
                new BigDecimal("5"), 1, 3, new BigDecimal("250.00")))
                .isEqualByComparingTo("12.50");
    }

    @Test
    @DisplayName("Weekly and monthly rates derive from the daily rate")
    void derivedRates_useFixedMultipliers() {
        assertThat(PricingUtil.weeklyRate(new BigDecimal("40.00"))).isEqualByComparingTo("260.00");
        assertThat(PricingUtil.monthlyRate(new BigDecimal("40.00"))).isEqualByComparingTo("1000.00");
    }

    @Test
    @DisplayName("Percentages round half up to cents")
    void percentOf_roundsHalfUpToCents() {
        assertThat(PricingUtil.percentOf(new BigDecimal("10.05"), new BigDecimal("15")))
                .isEqualByComparingTo("1.51");
    }
}
