package com.carhire.rental.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * DTO for a customer's booking request
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingRequest {

    @NotNull(message = "Vehicle ID is required")
    private Long vehicleId;

    @NotNull(message = "Pickup date is required")
    private LocalDateTime pickupDate;

    @NotNull(message = "Return date is required")
    private LocalDateTime returnDate;

    @NotBlank(message = "Pickup location is required")
    @Size(max = 200)
    private String pickupLocation;

    @NotBlank(message = "Return location is required")
    @Size(max = 200)
    private String returnLocation;

    private boolean insuranceSelected;

    @Size(max = 50)
    private String insuranceType;

    @DecimalMin(value = "0.00", message = "Insurance cost cannot be negative")
    private BigDecimal insuranceCost;

    @Size(max = 50)
    private String promotionCode;

    @Size(max = 2000)
    private String specialRequests;
}
