package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Last value issued for a numbering scope such as {@code INV2026} or
 * {@code RCP261019}. Always read with a write lock before incrementing.
 */
@Entity
@Table(name = "reference_sequences")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReferenceSequence {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scope_key", nullable = false, unique = true, length = 32)
    private String scopeKey;

    @Column(name = "last_value", nullable = false)
    private long lastValue;
}
