package com.carhire.rental.dto;

import com.carhire.rental.entity.PaymentType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentRequest {

    @NotNull(message = "Booking ID is required")
    private Long bookingId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    private BigDecimal amount;

    @Size(min = 3, max = 3, message = "Currency must be a 3-letter code")
    private String currency;

    private PaymentType paymentType;

    private Long paymentMethodId;

    @Pattern(regexp = "^\\d{4}$", message = "Card last four must be 4 digits")
    private String cardLastFour;

    @Size(max = 20)
    private String cardType;

    @Size(max = 1000)
    private String description;
}
