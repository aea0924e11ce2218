package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Earn rate and entry threshold of one loyalty tier.
 */
@Entity
@Table(name = "loyalty_programs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoyaltyProgram {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, unique = true, length = 20)
    private LoyaltyTier tier;

    @Column(nullable = false)
    private int minPointsRequired;

    @Column(precision = 4, scale = 2)
    @Builder.Default
    private BigDecimal pointsPerUnit = BigDecimal.ONE;

    @Column(precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal discountPercentage = BigDecimal.ZERO;

    @Column(length = 2000)
    private String benefits;

    @Builder.Default
    private boolean active = true;
}
