package com.carhire.rental.dto;

import com.carhire.rental.entity.FuelType;
import com.carhire.rental.entity.TransmissionType;
import com.carhire.rental.entity.VehicleCondition;
import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Create or replace a fleet vehicle
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleRequest {

    @NotNull(message = "Model ID is required")
    private Long modelId;

    @Min(value = 1990, message = "Year must be 1990 or later")
    @Max(value = 2100, message = "Year is not plausible")
    private int year;

    @Size(max = 50)
    private String color;

    @NotBlank(message = "License plate is required")
    @Size(max = 20)
    private String licensePlate;

    @Size(min = 17, max = 17, message = "VIN must be 17 characters")
    private String vinNumber;

    private FuelType fuelType;
    private TransmissionType transmission;
    private VehicleCondition condition;

    @Min(1) @Max(50)
    private Integer seatingCapacity;

    @Min(1) @Max(6)
    private Integer doors;

    @DecimalMin(value = "0.00")
    private BigDecimal fuelTankCapacity;

    @Min(0)
    private Integer currentMileage;

    @NotNull(message = "Daily rate is required")
    @DecimalMin(value = "0.01", message = "Daily rate must be positive")
    private BigDecimal dailyRate;

    @DecimalMin(value = "0.01")
    private BigDecimal weeklyRate;

    @DecimalMin(value = "0.01")
    private BigDecimal monthlyRate;

    @DecimalMin(value = "0.00")
    private BigDecimal securityDeposit;

    private String currentLocation;

    private boolean featured;
}
