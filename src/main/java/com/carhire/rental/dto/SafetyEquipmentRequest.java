package com.carhire.rental.dto;

import com.carhire.rental.entity.SafetyEquipmentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SafetyEquipmentRequest {

    @NotBlank(message = "Equipment type is required")
    private String equipmentType;

    @NotNull(message = "Status is required")
    private SafetyEquipmentStatus status;

    private LocalDate expiryDate;
    private LocalDate lastInspectionDate;
    private String notes;
}
