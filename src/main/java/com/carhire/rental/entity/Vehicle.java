package com.carhire.rental.entity;

import com.carhire.rental.util.PricingUtil;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single fleet unit.
 *
 * Weekly and monthly rates are optional; when unset the quoted rate falls
 * back to a multiple of the daily rate (see {@link PricingUtil}).
 */
@Entity
@Table(
    name = "vehicles",
    indexes = {
        @Index(name = "idx_vehicle_status",   columnList = "status"),
        @Index(name = "idx_vehicle_featured", columnList = "featured")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "model_id", nullable = false)
    private VehicleModel model;

    @Column(name = "model_year", nullable = false)
    private int year;

    @Column(length = 50)
    private String color;

    @Column(name = "license_plate", nullable = false, unique = true, length = 20)
    private String licensePlate;

    @Column(name = "vin_number", unique = true, length = 17)
    private String vinNumber;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    @Builder.Default
    private FuelType fuelType = FuelType.PETROL;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    @Builder.Default
    private TransmissionType transmission = TransmissionType.MANUAL;

    @Builder.Default
    private int seatingCapacity = 5;

    @Builder.Default
    private int doors = 4;

    /** Litres. Used when charging for missing fuel on return. */
    @Column(precision = 6, scale = 2)
    private BigDecimal fuelTankCapacity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private VehicleStatus status = VehicleStatus.AVAILABLE;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_condition", length = 20)
    @Builder.Default
    private VehicleCondition condition = VehicleCondition.EXCELLENT;

    @Builder.Default
    private int currentMileage = 0;

    @Builder.Default
    private int lastServiceMileage = 0;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal dailyRate;

    @Column(precision = 10, scale = 2)
    private BigDecimal weeklyRate;

    @Column(precision = 10, scale = 2)
    private BigDecimal monthlyRate;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal securityDeposit = BigDecimal.ZERO;

    private String currentLocation;

    @Builder.Default
    private boolean featured = false;

    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isAvailableForBooking() {
        return status == VehicleStatus.AVAILABLE && active;
    }

    public BigDecimal getEffectiveWeeklyRate() {
        return weeklyRate != null ? weeklyRate : PricingUtil.weeklyRate(dailyRate);
    }

    public BigDecimal getEffectiveMonthlyRate() {
        return monthlyRate != null ? monthlyRate : PricingUtil.monthlyRate(dailyRate);
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
