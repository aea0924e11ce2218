package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Accepted payment channel and the gateway fee it carries.
 */
@Entity
@Table(name = "payment_methods")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentMethod {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethodType methodType;

    @Column(precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal processingFeePercentage = BigDecimal.ZERO;

    @Column(precision = 6, scale = 2)
    @Builder.Default
    private BigDecimal processingFeeFixed = BigDecimal.ZERO;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private boolean requiresVerification = false;
}
