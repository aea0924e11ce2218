package com.carhire.rental.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.*;

import java.math.BigDecimal;

/**
 * Odometer and fuel reading taken when the vehicle is handed over or returned
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RentalHandoverRequest {

    @Min(value = 0, message = "Mileage cannot be negative")
    private Integer mileage;

    /** 0.0 (empty) to 1.0 (full) */
    @DecimalMin(value = "0.0", message = "Fuel level must be between 0.0 and 1.0")
    @DecimalMax(value = "1.0", message = "Fuel level must be between 0.0 and 1.0")
    private BigDecimal fuelLevel;

    private String notes;
}
