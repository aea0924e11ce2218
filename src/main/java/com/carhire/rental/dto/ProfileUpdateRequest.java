package com.carhire.rental.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.LocalDate;

/**
 * Partial profile update; null fields are left unchanged.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProfileUpdateRequest {

    @Email(message = "Email must be valid")
    private String email;

    private String firstName;
    private String lastName;

    @Pattern(regexp = "^\\+?1?\\d{9,15}$", message = "Phone number must be 9 to 15 digits, optionally prefixed with +")
    private String phoneNumber;

    @Past(message = "Date of birth must be in the past")
    private LocalDate dateOfBirth;

    private String addressLine1;
    private String addressLine2;
    private String city;
    private String stateProvince;
    private String postalCode;
    private String country;

    @Size(max = 50)
    private String driversLicenseNumber;

    private LocalDate licenseExpiryDate;

    @Size(max = 10)
    private String licenseClass;
}
