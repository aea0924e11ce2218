package com.carhire.rental.service;

import com.carhire.rental.dto.PriceQuote;
import com.carhire.rental.entity.Booking;
import com.carhire.rental.entity.BookingAddOnAssignment;
import com.carhire.rental.entity.BookingAdditionalDriver;
import com.carhire.rental.entity.Vehicle;
import com.carhire.rental.util.PricingUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Applies {@link PricingUtil} to bookings.
 *
 * Nothing recalculates on its own: callers invoke {@link #recalculate}
 * after changing dates, rate, add-ons, drivers, insurance or discount.
 * Tax is {@code app.pricing.tax-rate} percent of
 * subtotal + additional fees + insurance − discount.
 */
@Service
@Slf4j
public class PricingService {

    @Value("${app.pricing.tax-rate:15.00}")
    private BigDecimal taxRate;

    public BigDecimal getTaxRate() {
        return taxRate;
    }

    /**
     * Refreshes total days, subtotal, add-on line totals, additional fees,
     * tax and total on {@code booking}. Returns the same instance.
     */
    public Booking recalculate(Booking booking) {
        int days = PricingUtil.totalDays(booking.getPickupDate(), booking.getReturnDate());
        BigDecimal subtotal = PricingUtil.subtotal(booking.getDailyRate(), days);

        BigDecimal addOnTotal = BigDecimal.ZERO;
        for (BookingAddOnAssignment line : booking.getAddOns()) {
            BigDecimal lineTotal = PricingUtil.addOnLineTotal(
                    line.getAddOn().getPricingType(), line.getUnitPrice(), line.getQuantity(), days, subtotal);
            line.setTotalPrice(lineTotal);
            addOnTotal = addOnTotal.add(lineTotal);
        }

        BigDecimal driverFees = BigDecimal.ZERO;
        for (BookingAdditionalDriver driver : booking.getAdditionalDrivers()) {
            if (driver.getAdditionalFee() != null) {
                driverFees = driverFees.add(driver.getAdditionalFee());
            }
        }

        BigDecimal additionalFees = PricingUtil.money(addOnTotal.add(driverFees));
        BigDecimal insurance = booking.isInsuranceSelected() && booking.getInsuranceCost() != null
                ? booking.getInsuranceCost() : BigDecimal.ZERO;
        BigDecimal discount = booking.getDiscountAmount() != null ? booking.getDiscountAmount() : BigDecimal.ZERO;

        BigDecimal taxable = subtotal.add(additionalFees).add(insurance).subtract(discount).max(BigDecimal.ZERO);
        BigDecimal tax = PricingUtil.percentOf(taxable, taxRate);

        booking.setTotalDays(days);
        booking.setSubtotal(subtotal);
        booking.setAdditionalFees(additionalFees);
        booking.setTaxAmount(tax);
        booking.setDiscountAmount(PricingUtil.money(discount));
        booking.setTotalAmount(PricingUtil.total(subtotal, tax, additionalFees, insurance, discount));

        log.debug("Priced booking {}: {} day(s), subtotal {}, fees {}, tax {}, total {}",
                booking.getBookingReference(), days, subtotal, additionalFees, tax, booking.getTotalAmount());
        return booking;
    }

    /**
     * Rental-only price for a vehicle and date range, tax included.
     * {@code available} is left false; the caller fills it in.
     */
    public PriceQuote quote(Vehicle vehicle, LocalDateTime pickup, LocalDateTime dropOff) {
        int days = PricingUtil.totalDays(pickup, dropOff);
        BigDecimal subtotal = PricingUtil.subtotal(vehicle.getDailyRate(), days);
        BigDecimal tax = PricingUtil.percentOf(subtotal, taxRate);
        return PriceQuote.builder()
                .vehicleId(vehicle.getId())
                .totalDays(days)
                .dailyRate(vehicle.getDailyRate())
                .weeklyRate(vehicle.getEffectiveWeeklyRate())
                .monthlyRate(vehicle.getEffectiveMonthlyRate())
                .subtotal(subtotal)
                .taxAmount(tax)
                .totalAmount(PricingUtil.total(subtotal, tax, null, null, null))
                .securityDeposit(vehicle.getSecurityDeposit())
                .build();
    }
}
