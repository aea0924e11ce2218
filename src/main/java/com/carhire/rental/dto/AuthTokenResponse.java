package com.carhire.rental.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuthTokenResponse {

    private String access;
    private String refresh;
    private long expiresInMs;
    private UserProfileResponse user;
}
