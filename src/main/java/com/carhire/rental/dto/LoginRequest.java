package com.carhire.rental.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Login by username or email
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoginRequest {

    @NotBlank(message = "Username or email is required")
    private String username;

    @NotBlank(message = "Password is required")
    private String password;
}
