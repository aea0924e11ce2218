package com.carhire.rental.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MaintenanceCompletionRequest {

    @NotNull(message = "Mileage at service is required")
    @Min(0)
    private Integer mileageAtService;

    @DecimalMin("0.00")
    private BigDecimal actualCost;
}
