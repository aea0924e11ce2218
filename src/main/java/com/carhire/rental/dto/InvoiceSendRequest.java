package com.carhire.rental.dto;

import jakarta.validation.constraints.Email;
import lombok.*;

/**
 * Address the invoice goes to; defaults to the customer's email.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InvoiceSendRequest {

    @Email(message = "Email must be valid")
    private String email;
}
