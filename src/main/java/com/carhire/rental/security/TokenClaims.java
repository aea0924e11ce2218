package com.carhire.rental.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Verified contents of a bearer token.
 */
@Getter
@AllArgsConstructor
@Builder
public class TokenClaims {

    private final String tokenId;
    private final String username;
    private final Long userId;
    private final String role;
    private final String type;
    private final Instant expiresAt;

    public boolean isAccessToken() {
        return JwtTokenProvider.TYPE_ACCESS.equals(type);
    }

    public boolean isRefreshToken() {
        return JwtTokenProvider.TYPE_REFRESH.equals(type);
    }
}
