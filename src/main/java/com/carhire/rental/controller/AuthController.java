package com.carhire.rental.controller;

import com.carhire.rental.config.AuthInterceptor;
import com.carhire.rental.dto.*;
import com.carhire.rental.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Account endpoints.
 *
 *   POST /api/auth/register            - public
 *   POST /api/auth/login               - public, username or email
 *   POST /api/auth/token/refresh       - public
 *   GET  /api/auth/check-username      - public
 *   GET  /api/auth/check-email         - public
 *   everything else                    - bearer access token
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<ApiResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthTokenResponse tokens = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(tokens, "Registration successful"));
    }

    @PostMapping("/login")
    public ResponseEntity<ApiResponse> login(@Valid @RequestBody LoginRequest request,
                                             HttpServletRequest http) {
        AuthTokenResponse tokens = authService.login(request, clientIp(http), http.getHeader("User-Agent"));
        return ResponseEntity.ok(ApiResponse.success(tokens, "Login successful"));
    }

    @PostMapping("/token/refresh")
    public ResponseEntity<ApiResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(ApiResponse.success(authService.refresh(request.getRefresh()), "Token refreshed"));
    }

    /** Always reports success; token revocation is best-effort. */
    @PostMapping("/logout")
    public ResponseEntity<ApiResponse> logout(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                              @RequestBody(required = false) LogoutRequest request) {
        authService.logout(userId, request != null ? request.getRefreshToken() : null);
        return ResponseEntity.ok(ApiResponse.success("Logout successful"));
    }

    @GetMapping("/profile")
    public ResponseEntity<ApiResponse> profile(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(authService.profile(userId), "Profile retrieved"));
    }

    @PutMapping("/profile")
    public ResponseEntity<ApiResponse> updateProfile(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                     @Valid @RequestBody ProfileUpdateRequest request) {
        return ResponseEntity.ok(ApiResponse.success(authService.updateProfile(userId, request), "Profile updated"));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<ApiResponse> dashboard(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(authService.dashboard(userId), "Dashboard retrieved"));
    }

    @PostMapping("/password/change")
    public ResponseEntity<ApiResponse> changePassword(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                      @Valid @RequestBody PasswordChangeRequest request) {
        authService.changePassword(userId, request);
        return ResponseEntity.ok(ApiResponse.success("Password changed"));
    }

    @GetMapping("/sessions")
    public ResponseEntity<ApiResponse> sessions(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(authService.sessions(userId), "Active sessions"));
    }

    @GetMapping("/preferences")
    public ResponseEntity<ApiResponse> preferences(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(authService.preferences(userId), "Preferences retrieved"));
    }

    @PutMapping("/preferences")
    public ResponseEntity<ApiResponse> updatePreferences(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
                                                         @Valid @RequestBody PreferenceUpdateRequest request) {
        return ResponseEntity.ok(ApiResponse.success(authService.updatePreferences(userId, request), "Preferences updated"));
    }

    @GetMapping("/verification/status")
    public ResponseEntity<ApiResponse> verificationStatus(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(authService.verificationStatus(userId), "Verification status"));
    }

    @PostMapping("/verification/request")
    public ResponseEntity<ApiResponse> requestVerification(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(ApiResponse.success(authService.requestVerification(userId), "Verification requested"));
    }

    @GetMapping("/check-username")
    public ResponseEntity<ApiResponse> checkUsername(@RequestParam String username) {
        return ResponseEntity.ok(ApiResponse.success(
                availability("username", username, authService.isUsernameAvailable(username)), "Checked"));
    }

    @GetMapping("/check-email")
    public ResponseEntity<ApiResponse> checkEmail(@RequestParam String email) {
        return ResponseEntity.ok(ApiResponse.success(
                availability("email", email, authService.isEmailAvailable(email)), "Checked"));
    }

    private Map<String, Object> availability(String field, String value, boolean available) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(field, value);
        body.put("isAvailable", available);
        return body;
    }

    private String clientIp(HttpServletRequest http) {
        String forwarded = http.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return http.getRemoteAddr();
    }
}
