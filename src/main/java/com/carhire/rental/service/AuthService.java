package com.carhire.rental.service;

import com.carhire.rental.dto.*;
import com.carhire.rental.entity.*;
import com.carhire.rental.exception.AuthenticationFailedException;
import com.carhire.rental.exception.BusinessRuleException;
import com.carhire.rental.exception.DuplicateResourceException;
import com.carhire.rental.repository.*;
import com.carhire.rental.security.JwtTokenProvider;
import com.carhire.rental.security.TokenClaims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Accounts: registration, token login/refresh/logout, profile,
 * preferences, sessions and verification requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final UserSessionRepository sessionRepository;
    private final UserPreferenceRepository preferenceRepository;
    private final BlacklistedTokenRepository blacklistedTokenRepository;
    private final BookingRepository bookingRepository;
    private final UserAccessService userAccessService;
    private final JwtTokenProvider tokenProvider;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    // ── Registration & tokens ──

    @Transactional
    public AuthTokenResponse register(RegisterRequest request) {
        if (!request.getPassword().equals(request.getPasswordConfirm())) {
            throw new BusinessRuleException("Passwords do not match");
        }
        if (userRepository.existsByUsername(request.getUsername())) {
            throw new DuplicateResourceException("Username is already taken");
        }
        if (userRepository.existsByEmailIgnoreCase(request.getEmail())) {
            throw new DuplicateResourceException("Email is already registered");
        }

        User user = User.builder()
                .username(request.getUsername())
                .email(request.getEmail().toLowerCase(Locale.ROOT))
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .phoneNumber(request.getPhoneNumber())
                .build();
        User saved = userRepository.save(user);
        preferenceRepository.save(UserPreference.builder().user(saved).build());

        log.info("Registered user #{} '{}'", saved.getId(), saved.getUsername());
        return issueTokens(saved);
    }

    /**
     * {@code login} may be a username or an email address. Wrong credentials
     * and disabled accounts get the same 401.
     */
    @Transactional
    public AuthTokenResponse login(LoginRequest request, String ipAddress, String userAgent) {
        String login = request.getUsername().trim();
        User user = userRepository.findByUsername(login)
                .or(() -> userRepository.findByEmailIgnoreCase(login))
                .orElseThrow(() -> new AuthenticationFailedException("Invalid credentials"));

        if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            log.warn("Failed login for '{}'", login);
            throw new AuthenticationFailedException("Invalid credentials");
        }
        if (!user.isActive() || user.isSuspended()) {
            log.warn("Login refused for disabled account '{}'", login);
            throw new AuthenticationFailedException("Account is disabled");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        user.setLastLogin(now);
        userRepository.save(user);
        recordSession(user, ipAddress, userAgent, now);

        log.info("User '{}' logged in from {}", user.getUsername(), ipAddress);
        return issueTokens(user);
    }

    /** Exchanges a valid, non-blacklisted refresh token for a new access token. */
    @Transactional(readOnly = true)
    public AuthTokenResponse refresh(String refreshToken) {
        TokenClaims claims = tokenProvider.parse(refreshToken);
        if (!claims.isRefreshToken()) {
            throw new AuthenticationFailedException("Not a refresh token");
        }
        if (blacklistedTokenRepository.existsByTokenId(claims.getTokenId())) {
            throw new AuthenticationFailedException("Token has been revoked");
        }
        User user = userRepository.findById(claims.getUserId())
                .orElseThrow(() -> new AuthenticationFailedException("Unknown user"));
        if (!user.isActive() || user.isSuspended()) {
            throw new AuthenticationFailedException("Account is disabled");
        }
        return AuthTokenResponse.builder()
                .access(tokenProvider.generateAccessToken(user))
                .refresh(refreshToken)
                .expiresInMs(tokenProvider.getAccessExpirationMs())
                .user(UserProfileResponse.from(user))
                .build();
    }

    /**
     * Ends every session of the user and revokes the refresh token if one is
     * given. Revocation is best-effort: an unparseable token or a store
     * failure is logged and logout still succeeds.
     */
    @Transactional
    public void logout(Long userId, String refreshToken) {
        int closed = sessionRepository.deactivateAllForUser(userId);
        log.info("User #{} logged out, {} session(s) closed", userId, closed);

        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }
        try {
            TokenClaims claims = tokenProvider.parse(refreshToken);
            if (!blacklistedTokenRepository.existsByTokenId(claims.getTokenId())) {
                blacklistedTokenRepository.save(BlacklistedToken.builder()
                        .tokenId(claims.getTokenId())
                        .expiresAt(LocalDateTime.ofInstant(claims.getExpiresAt(), clock.getZone()))
                        .blacklistedAt(LocalDateTime.now(clock))
                        .build());
            }
        } catch (RuntimeException e) {
            log.warn("Could not blacklist refresh token for user #{}: {}", userId, e.getMessage());
        }
    }

    // ── Profile ──

    @Transactional(readOnly = true)
    public UserProfileResponse profile(Long userId) {
        return UserProfileResponse.from(userAccessService.requireUser(userId));
    }

    @Transactional
    public UserProfileResponse updateProfile(Long userId, ProfileUpdateRequest request) {
        User user = userAccessService.requireUser(userId);

        if (request.getEmail() != null && !request.getEmail().equalsIgnoreCase(user.getEmail())) {
            if (userRepository.existsByEmailIgnoreCase(request.getEmail())) {
                throw new DuplicateResourceException("Email is already registered");
            }
            user.setEmail(request.getEmail().toLowerCase(Locale.ROOT));
        }
        if (request.getDriversLicenseNumber() != null
                && !request.getDriversLicenseNumber().equals(user.getDriversLicenseNumber())) {
            if (userRepository.existsByDriversLicenseNumber(request.getDriversLicenseNumber())) {
                throw new DuplicateResourceException("Driver's licence number is already registered");
            }
            user.setDriversLicenseNumber(request.getDriversLicenseNumber());
        }
        if (request.getFirstName() != null) user.setFirstName(request.getFirstName());
        if (request.getLastName() != null) user.setLastName(request.getLastName());
        if (request.getPhoneNumber() != null) user.setPhoneNumber(request.getPhoneNumber());
        if (request.getDateOfBirth() != null) user.setDateOfBirth(request.getDateOfBirth());
        if (request.getAddressLine1() != null) user.setAddressLine1(request.getAddressLine1());
        if (request.getAddressLine2() != null) user.setAddressLine2(request.getAddressLine2());
        if (request.getCity() != null) user.setCity(request.getCity());
        if (request.getStateProvince() != null) user.setStateProvince(request.getStateProvince());
        if (request.getPostalCode() != null) user.setPostalCode(request.getPostalCode());
        if (request.getCountry() != null) user.setCountry(request.getCountry());
        if (request.getLicenseExpiryDate() != null) user.setLicenseExpiryDate(request.getLicenseExpiryDate());
        if (request.getLicenseClass() != null) user.setLicenseClass(request.getLicenseClass());

        return UserProfileResponse.from(userRepository.save(user));
    }

    @Transactional
    public DashboardResponse dashboard(Long userId) {
        User user = userAccessService.requireUser(userId);
        long total = bookingRepository.countByCustomerId(userId);
        long active = bookingRepository.countByCustomerIdAndStatusIn(userId, BookingStatus.BLOCKING);
        BigDecimal spent = bookingRepository.sumTotalAmountByCustomerAndStatus(userId, BookingStatus.COMPLETED);
        return DashboardResponse.builder()
                .user(UserProfileResponse.from(user))
                .totalBookings(total)
                .activeBookings(active)
                .totalSpent(spent)
                .preferences(preferencesOf(user))
                .build();
    }

    @Transactional
    public void changePassword(Long userId, PasswordChangeRequest request) {
        User user = userAccessService.requireUser(userId);
        if (!passwordEncoder.matches(request.getOldPassword(), user.getPasswordHash())) {
            throw new BusinessRuleException("Current password is incorrect");
        }
        if (!request.getNewPassword().equals(request.getNewPasswordConfirm())) {
            throw new BusinessRuleException("New passwords do not match");
        }
        user.setPasswordHash(passwordEncoder.encode(request.getNewPassword()));
        userRepository.save(user);
        log.info("User #{} changed password", userId);
    }

    @Transactional(readOnly = true)
    public List<UserSession> sessions(Long userId) {
        return sessionRepository.findByUserIdAndActiveTrueOrderByLastActivityDesc(userId);
    }

    // ── Preferences ──

    @Transactional
    public UserPreference preferences(Long userId) {
        return preferencesOf(userAccessService.requireUser(userId));
    }

    @Transactional
    public UserPreference updatePreferences(Long userId, PreferenceUpdateRequest request) {
        UserPreference pref = preferencesOf(userAccessService.requireUser(userId));
        if (request.getEmailNotifications() != null) pref.setEmailNotifications(request.getEmailNotifications());
        if (request.getSmsNotifications() != null) pref.setSmsNotifications(request.getSmsNotifications());
        if (request.getPushNotifications() != null) pref.setPushNotifications(request.getPushNotifications());
        if (request.getMarketingEmails() != null) pref.setMarketingEmails(request.getMarketingEmails());
        if (request.getAutoInsurance() != null) pref.setAutoInsurance(request.getAutoInsurance());
        if (request.getPreferredFuelPolicy() != null) pref.setPreferredFuelPolicy(request.getPreferredFuelPolicy());
        if (request.getCurrency() != null) pref.setCurrency(request.getCurrency());
        if (request.getDateFormat() != null) pref.setDateFormat(request.getDateFormat());
        if (request.getTimeFormat() != null) pref.setTimeFormat(request.getTimeFormat());
        if (request.getLanguage() != null) pref.setLanguage(request.getLanguage());
        return preferenceRepository.save(pref);
    }

    // ── Verification ──

    @Transactional(readOnly = true)
    public Map<String, Object> verificationStatus(Long userId) {
        User user = userAccessService.requireUser(userId);
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("verified", user.isVerified());
        status.put("verificationLevel", user.getVerificationLevel());
        status.put("verificationDate", user.getVerificationDate());
        status.put("hasDriversLicense", user.getDriversLicenseNumber() != null);
        return status;
    }

    @Transactional
    public Map<String, Object> requestVerification(Long userId) {
        User user = userAccessService.requireUser(userId);
        if (user.isVerified()) {
            throw new BusinessRuleException("Account is already verified");
        }
        if (user.getVerificationLevel() == VerificationLevel.PENDING) {
            throw new BusinessRuleException("Verification is already pending");
        }
        if (user.getDriversLicenseNumber() == null) {
            throw new BusinessRuleException("Add a driver's licence number before requesting verification");
        }
        user.setVerificationLevel(VerificationLevel.PENDING);
        userRepository.save(user);
        log.info("User #{} requested verification", userId);
        return verificationStatus(userId);
    }

    // ── Availability checks ──

    public boolean isUsernameAvailable(String username) {
        if (username == null || username.isBlank()) {
            throw new BusinessRuleException("Username is required");
        }
        return !userRepository.existsByUsername(username.trim());
    }

    public boolean isEmailAvailable(String email) {
        if (email == null || email.isBlank()) {
            throw new BusinessRuleException("Email is required");
        }
        return !userRepository.existsByEmailIgnoreCase(email.trim());
    }

    private AuthTokenResponse issueTokens(User user) {
        return AuthTokenResponse.builder()
                .access(tokenProvider.generateAccessToken(user))
                .refresh(tokenProvider.generateRefreshToken(user))
                .expiresInMs(tokenProvider.getAccessExpirationMs())
                .user(UserProfileResponse.from(user))
                .build();
    }

    private UserPreference preferencesOf(User user) {
        return preferenceRepository.findByUserId(user.getId())
                .orElseGet(() -> preferenceRepository.save(UserPreference.builder().user(user).build()));
    }

    private void recordSession(User user, String ipAddress, String userAgent, LocalDateTime now) {
        UserSession session = sessionRepository.findFirstByUserIdAndUserAgent(user.getId(), userAgent)
                .orElseGet(() -> UserSession.builder()
                        .user(user)
                        .sessionKey(UUID.randomUUID().toString())
                        .userAgent(userAgent)
                        .deviceType(deviceType(userAgent))
                        .createdAt(now)
                        .build());
        session.setIpAddress(ipAddress);
        session.setActive(true);
        session.setLastActivity(now);
        sessionRepository.save(session);
    }

    private String deviceType(String userAgent) {
        if (userAgent == null) {
            return "unknown";
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        if (ua.contains("mobile") || ua.contains("android") || ua.contains("iphone")) {
            return "mobile";
        }
        if (ua.contains("ipad") || ua.contains("tablet")) {
            return "tablet";
        }
        return "desktop";
    }
}
