package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(
    name = "promotions",
    indexes = @Index(name = "idx_promotion_active_window", columnList = "active, start_date, end_date")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Promotion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DiscountType discountType;

    /** Percentage points, currency amount or number of days, depending on type. */
    @Column(nullable = false, precision = 8, scale = 2)
    private BigDecimal discountValue;

    @Column(precision = 8, scale = 2)
    private BigDecimal maxDiscountAmount;

    @Column(name = "start_date", nullable = false)
    private LocalDateTime startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDateTime endDate;

    private Integer usageLimit;

    @Builder.Default
    private int usageCount = 0;

    @Builder.Default
    private int perCustomerLimit = 1;

    @Column(precision = 8, scale = 2)
    private BigDecimal minBookingAmount;

    private Integer minRentalDays;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private boolean publicPromotion = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isWithinWindow(LocalDateTime at) {
        return !at.isBefore(startDate) && !at.isAfter(endDate);
    }

    public boolean isExhausted() {
        return usageLimit != null && usageCount >= usageLimit;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
