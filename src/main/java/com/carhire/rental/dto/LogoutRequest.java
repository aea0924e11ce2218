package com.carhire.rental.dto;

import lombok.*;

/**
 * Refresh token to revoke. Optional: logout succeeds without it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LogoutRequest {

    private String refreshToken;
}
