package com.carhire.rental.config;

import com.carhire.rental.entity.UserType;
import com.carhire.rental.exception.AuthenticationFailedException;
import com.carhire.rental.security.JwtTokenProvider;
import com.carhire.rental.security.TokenClaims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.List;

/**
 * AuthInterceptor: Bearer token guard for the REST API.
 *
 * Behaviour:
 *  - Valid access token    → user id and role stored as request attributes,
 *                            request proceeds
 *  - Missing/invalid token → HTTP 401 JSON body
 *  - /api/admin/** without a staff role → HTTP 403 JSON body
 *  - GET on public catalogue reads → allowed anonymously; a token, when
 *    present, is still resolved so owners see their own data
 *
 * Registered on /api/** in WebMvcConfig, which also excludes the
 * registration, login, refresh and availability-check endpoints.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthInterceptor implements HandlerInterceptor {

    /** Request attribute holding the caller's user id (Long). */
    public static final String USER_ID_ATTRIBUTE = "authUserId";

    /** Request attribute holding the caller's {@link UserType}. */
    public static final String USER_TYPE_ATTRIBUTE = "authUserType";

    private static final String BEARER_PREFIX = "Bearer ";

    /** Paths readable with GET without a token. */
    private static final List<String> PUBLIC_GET_PREFIXES = List.of(
            "/api/vehicles",
            "/api/catalog",
            "/api/reviews/vehicle",
            "/api/reviews/featured",
            "/api/promotions/current"
    );

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    public boolean preHandle(HttpServletRequest request,
                             HttpServletResponse response,
                             Object handler) throws Exception {

        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }

        String path = request.getRequestURI();
        boolean publicRead = "GET".equalsIgnoreCase(request.getMethod()) && isPublicRead(path);

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            if (publicRead) {
                return true;
            }
            log.warn("Auth: missing bearer token on {} {}", request.getMethod(), path);
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Authentication credentials were not provided");
            return false;
        }

        TokenClaims claims;
        try {
            claims = jwtTokenProvider.parse(header.substring(BEARER_PREFIX.length()).trim());
        } catch (AuthenticationFailedException e) {
            log.warn("Auth: rejected token on {} {}: {}", request.getMethod(), path, e.getMessage());
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, e.getMessage());
            return false;
        }

        if (!claims.isAccessToken()) {
            log.warn("Auth: non-access token presented on {} {}", request.getMethod(), path);
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Access token required");
            return false;
        }

        UserType userType = UserType.valueOf(claims.getRole());
        if (path.startsWith("/api/admin/") && !userType.isStaff()) {
            log.warn("Auth: user #{} ({}) denied admin path {}", claims.getUserId(), userType, path);
            writeError(response, HttpServletResponse.SC_FORBIDDEN, "Staff access required");
            return false;
        }

        request.setAttribute(USER_ID_ATTRIBUTE, claims.getUserId());
        request.setAttribute(USER_TYPE_ATTRIBUTE, userType);
        log.debug("Auth: access granted to user #{} for {} {}", claims.getUserId(), request.getMethod(), path);
        return true;
    }

    private boolean isPublicRead(String path) {
        for (String prefix : PUBLIC_GET_PREFIXES) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private void writeError(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write(
                "{\"success\":false,\"message\":\"" + message.replace("\"", "'") + "\",\"data\":null}"
        );
    }
}
