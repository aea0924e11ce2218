package com.carhire.rental.dto;

import com.carhire.rental.entity.PaymentMethodType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentMethodRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Method type is required")
    private PaymentMethodType methodType;

    @DecimalMin("0.00") @DecimalMax("100.00")
    private BigDecimal processingFeePercentage;

    @DecimalMin("0.00")
    private BigDecimal processingFeeFixed;

    private boolean requiresVerification;
}
