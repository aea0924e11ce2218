package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A reservation of one vehicle by one customer for a date range.
 *
 * Monetary fields are derived by PricingService and are only refreshed
 * when it is called; nothing here recomputes them on save.
 */
@Entity
@Table(
    name = "bookings",
    indexes = {
        @Index(name = "idx_booking_customer_status", columnList = "customer_id, status"),
        @Index(name = "idx_booking_vehicle_pickup",  columnList = "vehicle_id, pickup_date"),
        @Index(name = "idx_booking_status_pickup",   columnList = "status, pickup_date"),
        @Index(name = "idx_booking_created",         columnList = "created_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_reference", nullable = false, unique = true, length = 20, updatable = false)
    private String bookingReference;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false)
    private User customer;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "vehicle_id", nullable = false)
    private Vehicle vehicle;

    // ── Dates ──
    @Column(name = "pickup_date", nullable = false)
    private LocalDateTime pickupDate;

    @Column(name = "return_date", nullable = false)
    private LocalDateTime returnDate;

    private LocalDateTime actualPickupDate;
    private LocalDateTime actualReturnDate;

    // ── Locations ──
    @Column(nullable = false, length = 200)
    private String pickupLocation;

    @Column(nullable = false, length = 200)
    private String returnLocation;

    // ── Status ──
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private BookingStatus status = BookingStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private BookingPaymentStatus paymentStatus = BookingPaymentStatus.PENDING;

    // ── Pricing ──
    @Column(nullable = false, precision = 8, scale = 2)
    private BigDecimal dailyRate;

    @Builder.Default
    private int totalDays = 1;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(precision = 8, scale = 2)
    @Builder.Default
    private BigDecimal taxAmount = BigDecimal.ZERO;

    @Column(precision = 8, scale = 2)
    @Builder.Default
    private BigDecimal discountAmount = BigDecimal.ZERO;

    @Column(precision = 8, scale = 2)
    @Builder.Default
    private BigDecimal additionalFees = BigDecimal.ZERO;

    @Column(precision = 8, scale = 2)
    @Builder.Default
    private BigDecimal securityDeposit = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal totalAmount = BigDecimal.ZERO;

    // ── Vehicle condition snapshots ──
    private Integer pickupMileage;
    private Integer returnMileage;

    /** 0.0 (empty) to 1.0 (full). */
    @Column(precision = 3, scale = 1)
    private BigDecimal pickupFuelLevel;

    @Column(precision = 3, scale = 1)
    private BigDecimal returnFuelLevel;

    @Column(length = 2000)
    private String specialRequests;

    @Column(length = 2000)
    private String staffNotes;

    // ── Insurance ──
    @Builder.Default
    private boolean insuranceSelected = false;

    @Column(length = 50)
    private String insuranceType;

    @Column(precision = 6, scale = 2)
    @Builder.Default
    private BigDecimal insuranceCost = BigDecimal.ZERO;

    // ── Loyalty and promotions ──
    @Builder.Default
    private int loyaltyPointsUsed = 0;

    @Builder.Default
    private int loyaltyPointsEarned = 0;

    @Column(length = 50)
    private String promotionCode;

    @Builder.Default
    private boolean confirmationSent = false;

    @Builder.Default
    private boolean reviewEligible = false;

    // ── Staff ──
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_staff_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User assignedStaff;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pickup_staff_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User pickupStaff;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "return_staff_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User returnStaff;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private List<BookingAddOnAssignment> addOns = new ArrayList<>();

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private List<BookingAdditionalDriver> additionalDrivers = new ArrayList<>();

    // ── Timestamps ──
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
    private LocalDateTime confirmedAt;
    private LocalDateTime cancelledAt;

    @Column(length = 1000)
    private String cancellationReason;

    /**
     * Pending or confirmed, and pickup still ahead of {@code now}.
     */
    public boolean canBeCancelled(LocalDateTime now) {
        return (status == BookingStatus.PENDING || status == BookingStatus.CONFIRMED)
                && pickupDate.isAfter(now);
    }

    public boolean isOverdue(LocalDateTime now) {
        return status == BookingStatus.ACTIVE && returnDate.isBefore(now);
    }

    public boolean isModifiable() {
        return status == BookingStatus.PENDING || status == BookingStatus.CONFIRMED;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
