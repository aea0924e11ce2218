package com.carhire.rental.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdditionalDriverRequest {

    @NotNull(message = "Driver ID is required")
    private Long driverId;

    @DecimalMin(value = "0.00", message = "Fee cannot be negative")
    private BigDecimal additionalFee;
}
