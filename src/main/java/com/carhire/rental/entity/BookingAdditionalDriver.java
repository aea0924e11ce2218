package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(
    name = "booking_additional_drivers",
    uniqueConstraints = @UniqueConstraint(name = "uk_booking_driver", columnNames = {"booking_id", "driver_id"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingAdditionalDriver {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "booking_id", nullable = false)
    private Booking booking;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "driver_id", nullable = false)
    private User driver;

    @Column(precision = 6, scale = 2)
    @Builder.Default
    private BigDecimal additionalFee = BigDecimal.ZERO;

    @Builder.Default
    private boolean approved = false;

    private LocalDateTime addedAt;
}
