package com.carhire.rental.security;

import com.carhire.rental.entity.User;
import com.carhire.rental.entity.UserType;
import com.carhire.rental.exception.AuthenticationFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hs256-signing";
    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    private final User user = User.builder().id(42L).username("chikondi").userType(UserType.CUSTOMER).build();

    private JwtTokenProvider provider(Instant at) {
        JwtTokenProvider provider = new JwtTokenProvider(Clock.fixed(at, ZoneOffset.UTC));
        ReflectionTestUtils.setField(provider, "jwtSecret", SECRET);
        ReflectionTestUtils.setField(provider, "accessExpirationMs", 3_600_000L);
        ReflectionTestUtils.setField(provider, "refreshExpirationMs", 604_800_000L);
        return provider;
    }

    @Test
    @DisplayName("Access token carries user id, role and type")
    void accessToken_roundTripsClaims() {
        JwtTokenProvider provider = provider(NOW);

        TokenClaims claims = provider.parse(provider.generateAccessToken(user));

        assertThat(claims.getUserId()).isEqualTo(42L);
        assertThat(claims.getUsername()).isEqualTo("chikondi");
        assertThat(claims.getRole()).isEqualTo("CUSTOMER");
        assertThat(claims.isAccessToken()).isTrue();
        assertThat(claims.isRefreshToken()).isFalse();
        assertThat(claims.getTokenId()).isNotBlank();
        assertThat(claims.getExpiresAt()).isEqualTo(NOW.plusMillis(3_600_000L));
    }

    @Test
    @DisplayName("Refresh token is typed as refresh")
    void refreshToken_isTyped() {
        JwtTokenProvider provider = provider(NOW);

        assertThat(provider.parse(provider.generateRefreshToken(user)).isRefreshToken()).isTrue();
    }

    @Test
    @DisplayName("Token used after expiry is rejected")
    void expiredToken_isRejected() {
        String token = provider(NOW).generateAccessToken(user);

        assertThatThrownBy(() -> provider(NOW.plus(Duration.ofHours(2))).parse(token))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    @DisplayName("A tampered token is rejected")
    void tamperedToken_isRejected() {
        JwtTokenProvider provider = provider(NOW);
        String token = provider.generateAccessToken(user);
        String tampered = token.substring(0, token.length() - 4) + "AAAA";

        assertThatThrownBy(() -> provider.parse(tampered))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    @DisplayName("A blank token is rejected")
    void blankToken_isRejected() {
        assertThatThrownBy(() -> provider(NOW).parse(" "))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Token is missing");
    }
}
