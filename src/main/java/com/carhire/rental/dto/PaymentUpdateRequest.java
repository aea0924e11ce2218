package com.carhire.rental.dto;

import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Gateway outcome reported when a payment completes or fails
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentUpdateRequest {

    @Size(max = 100)
    private String gatewayTransactionId;

    @Size(max = 500)
    private String reason;
}
