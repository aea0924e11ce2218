package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Catalogue entry for an optional extra (GPS, child seat, ...).
 */
@Entity
@Table(name = "booking_add_ons")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingAddOn {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AddOnType addOnType;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AddOnPricingType pricingType = AddOnPricingType.PER_DAY;

    /** Amount, or percentage points when {@code pricingType} is PERCENTAGE. */
    @Column(nullable = false, precision = 8, scale = 2)
    private BigDecimal price;

    @Builder.Default
    private boolean active = true;
}
