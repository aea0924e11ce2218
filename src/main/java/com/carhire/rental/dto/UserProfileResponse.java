package com.carhire.rental.dto;

import com.carhire.rental.entity.LoyaltyTier;
import com.carhire.rental.entity.User;
import com.carhire.rental.entity.UserType;
import com.carhire.rental.entity.VerificationLevel;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Public view of an account. Never carries the password hash.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfileResponse {

    private Long id;
    private String username;
    private String email;
    private String firstName;
    private String lastName;
    private String fullName;
    private UserType userType;
    private String phoneNumber;
    private LocalDate dateOfBirth;
    private String addressLine1;
    private String addressLine2;
    private String city;
    private String stateProvince;
    private String postalCode;
    private String country;
    private String driversLicenseNumber;
    private LocalDate licenseExpiryDate;
    private String licenseClass;
    private boolean verified;
    private VerificationLevel verificationLevel;
    private boolean suspended;
    private int loyaltyPoints;
    private LoyaltyTier loyaltyTier;
    private LocalDateTime lastLogin;
    private LocalDateTime createdAt;

    public static UserProfileResponse from(User user) {
        return UserProfileResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .fullName(user.getFullName())
                .userType(user.getUserType())
                .phoneNumber(user.getPhoneNumber())
                .dateOfBirth(user.getDateOfBirth())
                .addressLine1(user.getAddressLine1())
                .addressLine2(user.getAddressLine2())
                .city(user.getCity())
                .stateProvince(user.getStateProvince())
                .postalCode(user.getPostalCode())
                .country(user.getCountry())
                .driversLicenseNumber(user.getDriversLicenseNumber())
                .licenseExpiryDate(user.getLicenseExpiryDate())
                .licenseClass(user.getLicenseClass())
                .verified(user.isVerified())
                .verificationLevel(user.getVerificationLevel())
                .suspended(user.isSuspended())
                .loyaltyPoints(user.getLoyaltyPoints())
                .loyaltyTier(user.getLoyaltyTier())
                .lastLogin(user.getLastLogin())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
