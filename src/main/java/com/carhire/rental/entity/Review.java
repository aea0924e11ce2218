package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

/**
 * Customer review of a completed rental. One per booking.
 * Ratings are 1 to 5; sub-ratings are optional.
 */
@Entity
@Table(
    name = "reviews",
    indexes = @Index(name = "idx_review_vehicle_approved", columnList = "vehicle_id, approved")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Review {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false)
    private User customer;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "booking_id", nullable = false, unique = true)
    private Booking booking;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "vehicle_id", nullable = false)
    private Vehicle vehicle;

    @Column(nullable = false)
    private int overallRating;

    private Integer vehicleConditionRating;
    private Integer serviceRating;
    private Integer valueForMoneyRating;

    @Column(length = 200)
    private String title;

    @Column(nullable = false, length = 4000)
    private String comment;

    @Builder.Default
    private boolean verified = false;

    @Builder.Default
    private boolean approved = false;

    @Builder.Default
    private boolean featured = false;

    @Builder.Default
    private int helpfulVotes = 0;

    @Builder.Default
    private int totalVotes = 0;

    @Column(length = 4000)
    private String companyResponse;

    private LocalDateTime responseDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "responded_by_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User respondedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

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
