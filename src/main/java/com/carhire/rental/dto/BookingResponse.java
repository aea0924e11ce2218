package com.carhire.rental.dto;

import com.carhire.rental.entity.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingResponse {

    private Long id;
    private String bookingReference;
    private Long customerId;
    private String customerUsername;
    private Long vehicleId;
    private String vehicleLicensePlate;
    private LocalDateTime pickupDate;
    private LocalDateTime returnDate;
    private LocalDateTime actualPickupDate;
    private LocalDateTime actualReturnDate;
    private String pickupLocation;
    private String returnLocation;
    private BookingStatus status;
    private BookingPaymentStatus paymentStatus;
    private BigDecimal dailyRate;
    private int totalDays;
    private BigDecimal subtotal;
    private BigDecimal taxAmount;
    private BigDecimal discountAmount;
    private BigDecimal additionalFees;
    private BigDecimal insuranceCost;
    private BigDecimal securityDeposit;
    private BigDecimal totalAmount;
    private String promotionCode;
    private Integer pickupMileage;
    private Integer returnMileage;
    private BigDecimal pickupFuelLevel;
    private BigDecimal returnFuelLevel;
    private int loyaltyPointsEarned;
    private boolean reviewEligible;
    private List<AddOnLine> addOns;
    private List<DriverLine> additionalDrivers;
    private LocalDateTime createdAt;
    private LocalDateTime confirmedAt;
    private LocalDateTime cancelledAt;
    private String cancellationReason;

    @Getter
    @AllArgsConstructor
    public static class AddOnLine {
        private Long addOnId;
        private String name;
        private int quantity;
        private BigDecimal unitPrice;
        private BigDecimal totalPrice;
    }

    @Getter
    @AllArgsConstructor
    public static class DriverLine {
        private Long driverId;
        private String username;
        private BigDecimal additionalFee;
        private boolean approved;
    }

    public static BookingResponse from(Booking b) {
        return BookingResponse.builder()
                .id(b.getId())
                .bookingReference(b.getBookingReference())
                .customerId(b.getCustomer().getId())
                .customerUsername(b.getCustomer().getUsername())
                .vehicleId(b.getVehicle().getId())
                .vehicleLicensePlate(b.getVehicle().getLicensePlate())
                .pickupDate(b.getPickupDate())
                .returnDate(b.getReturnDate())
                .actualPickupDate(b.getActualPickupDate())
                .actualReturnDate(b.getActualReturnDate())
                .pickupLocation(b.getPickupLocation())
                .returnLocation(b.getReturnLocation())
                .status(b.getStatus())
                .paymentStatus(b.getPaymentStatus())
                .dailyRate(b.getDailyRate())
                .totalDays(b.getTotalDays())
                .subtotal(b.getSubtotal())
                .taxAmount(b.getTaxAmount())
                .discountAmount(b.getDiscountAmount())
                .additionalFees(b.getAdditionalFees())
                .insuranceCost(b.getInsuranceCost())
                .securityDeposit(b.getSecurityDeposit())
                .totalAmount(b.getTotalAmount())
                .promotionCode(b.getPromotionCode())
                .pickupMileage(b.getPickupMileage())
                .returnMileage(b.getReturnMileage())
                .pickupFuelLevel(b.getPickupFuelLevel())
                .returnFuelLevel(b.getReturnFuelLevel())
                .loyaltyPointsEarned(b.getLoyaltyPointsEarned())
                .reviewEligible(b.isReviewEligible())
                .addOns(b.getAddOns().stream()
                        .map(a -> new AddOnLine(a.getAddOn().getId(), a.getAddOn().getName(),
                                a.getQuantity(), a.getUnitPrice(), a.getTotalPrice()))
                        .collect(Collectors.toList()))
                .additionalDrivers(b.getAdditionalDrivers().stream()
                        .map(d -> new DriverLine(d.getDriver().getId(), d.getDriver().getUsername(),
                                d.getAdditionalFee(), d.isApproved()))
                        .collect(Collectors.toList()))
                .createdAt(b.getCreatedAt())
                .confirmedAt(b.getConfirmedAt())
                .cancelledAt(b.getCancelledAt())
                .cancellationReason(b.getCancellationReason())
                .build();
    }
}
