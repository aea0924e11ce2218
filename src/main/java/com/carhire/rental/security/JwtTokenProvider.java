package com.carhire.rental.security;

import com.carhire.rental.entity.User;
import com.carhire.rental.exception.AuthenticationFailedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies the bearer tokens handed out by AuthService.
 *
 * Both token kinds are HMAC-signed JWTs with subject = username and claims
 * {@code uid}, {@code role}, {@code type} ("access" or "refresh") and a
 * random {@code jti}. Only refresh token ids are ever blacklisted.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    public static final String TYPE_ACCESS  = "access";
    public static final String TYPE_REFRESH = "refresh";

    private static final String CLAIM_USER_ID = "uid";
    private static final String CLAIM_ROLE    = "role";
    private static final String CLAIM_TYPE    = "type";

    private final Clock clock;

    /** HMAC secret, at least 256 bits for HS256. */
    @Value("${app.jwt.secret}")
    private String jwtSecret;

    @Value("${app.jwt.access-expiration-ms:3600000}")
    private long accessExpirationMs;

    @Value("${app.jwt.refresh-expiration-ms:604800000}")
    private long refreshExpirationMs;

    public JwtTokenProvider(Clock clock) {
        this.clock = clock;
    }

    private SecretKey getSigningKey() {
        return Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    public String generateAccessToken(User user) {
        return generate(user, TYPE_ACCESS, accessExpirationMs);
    }

    public String generateRefreshToken(User user) {
        return generate(user, TYPE_REFRESH, refreshExpirationMs);
    }

    public long getAccessExpirationMs() {
        return accessExpirationMs;
    }

    private String generate(User user, String type, long ttlMs) {
        long now = clock.millis();
        return Jwts.builder()
                .subject(user.getUsername())
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_USER_ID, user.getId())
                .claim(CLAIM_ROLE, user.getUserType().name())
                .claim(CLAIM_TYPE, type)
                .issuedAt(new Date(now))
                .expiration(new Date(now + ttlMs))
                .signWith(getSigningKey())
                .compact();
    }

    /**
     * Verifies signature and expiry and returns the claims.
     *
     * @throws AuthenticationFailedException if the token is malformed, forged or expired
     */
    public TokenClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailedException("Token is missing");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(getSigningKey())
                    .clock(() -> new Date(clock.millis()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return TokenClaims.builder()
                    .tokenId(claims.getId())
                    .username(claims.getSubject())
                    .userId(claims.get(CLAIM_USER_ID, Long.class))
                    .role(claims.get(CLAIM_ROLE, String.class))
                    .type(claims.get(CLAIM_TYPE, String.class))
                    .expiresAt(claims.getExpiration().toInstant())
                    .build();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new AuthenticationFailedException("Token is invalid or expired", e);
        }
    }
}
