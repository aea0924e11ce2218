package com.carhire.rental.dto;

import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Partial preference update; null fields are left unchanged.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PreferenceUpdateRequest {

    private Boolean emailNotifications;
    private Boolean smsNotifications;
    private Boolean pushNotifications;
    private Boolean marketingEmails;
    private Boolean autoInsurance;
    private String preferredFuelPolicy;

    @Size(min = 3, max = 3, message = "Currency must be a 3-letter code")
    private String currency;

    private String dateFormat;
    private String timeFormat;
    private String language;
}
