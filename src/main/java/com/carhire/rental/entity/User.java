package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Customer or staff account.
 *
 * Username and email are both unique and both accepted as login names.
 * The password column only ever holds a BCrypt hash.
 */
@Entity
@Table(
    name = "auth_user_extended",
    indexes = {
        @Index(name = "idx_user_type",         columnList = "user_type"),
        @Index(name = "idx_user_verified",     columnList = "verified"),
        @Index(name = "idx_user_loyalty_tier", columnList = "loyalty_tier")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 150)
    private String username;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    private String firstName;
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", nullable = false, length = 20)
    @Builder.Default
    private UserType userType = UserType.CUSTOMER;

    @Column(length = 17)
    private String phoneNumber;

    private LocalDate dateOfBirth;

    // Address
    private String addressLine1;
    private String addressLine2;
    private String city;
    private String stateProvince;
    private String postalCode;

    @Builder.Default
    private String country = "Malawi";

    // Driver's licence
    @Column(unique = true, length = 50)
    private String driversLicenseNumber;
    private LocalDate licenseExpiryDate;
    @Column(length = 10)
    private String licenseClass;

    // Account status
    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private boolean verified = false;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    @Builder.Default
    private VerificationLevel verificationLevel = VerificationLevel.NONE;

    private LocalDateTime verificationDate;

    @Builder.Default
    private boolean suspended = false;

    private String suspensionReason;

    // Loyalty program
    @Builder.Default
    private int loyaltyPoints = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "loyalty_tier", length = 20)
    @Builder.Default
    private LoyaltyTier loyaltyTier = LoyaltyTier.BRONZE;

    private LocalDateTime lastLogin;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public String getFullName() {
        String first = firstName != null ? firstName : "";
        String last  = lastName != null ? lastName : "";
        return (first + " " + last).trim();
    }

    public boolean isStaff() {
        return userType != null && userType.isStaff();
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
