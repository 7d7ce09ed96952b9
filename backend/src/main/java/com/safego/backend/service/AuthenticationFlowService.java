package com.safego.backend.service;

import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.LoginContext;
import com.safego.backend.dto.LoginResult;
import com.safego.backend.dto.LoginRiskAssessment;
import com.safego.backend.dto.ThrottleDecision;
import com.safego.backend.dto.TokenPair;
import com.safego.backend.exception.TooManyRequestsException;
import com.safego.backend.exception.UnauthorizedException;
import com.safego.backend.model.UserAccount;
import com.safego.backend.repository.UserAccountRepository;
import com.safego.backend.security.UserPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Login, refresh and logout as exposed over HTTP. Throttling runs before the credential check,
 * and suspicious login detection runs after tokens are issued without affecting the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationFlowService {

    public static final String IDENTIFIER_EMAIL = "email";
    public static final String IDENTIFIER_PHONE = "phone";
    public static final String IDENTIFIER_USER_ID = "user_id";

    static final String INVALID_CREDENTIALS = "invalid_credentials";
    static final String ACCOUNT_DISABLED = "account_disabled";

    private final LoginThrottleService loginThrottleService;
    private final SessionTokenService sessionTokenService;
    private final SuspiciousLoginService suspiciousLoginService;
    private final DeviceHistoryService deviceHistoryService;
    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public LoginResult login(String identifier, String password, DeviceContext device) {
        String normalized = identifier.trim();
        String identifierType = identifierType(normalized);

        ThrottleDecision decision = loginThrottleService.check(normalized, identifierType, device);
        if (!decision.allowed()) {
            long retryAfter = Math.max(1, Duration.between(clock.instant(), decision.retryAt()).toSeconds());
            throw new TooManyRequestsException(decision.reason(), decision.retryAt(), retryAfter);
        }

        Optional<UserAccount> account = findAccount(normalized, identifierType);
        if (account.isEmpty() || !passwordEncoder.matches(password, account.get().getPasswordHash())) {
            loginThrottleService.recordAttempt(normalized, identifierType, false, INVALID_CREDENTIALS, device);
            throw new UnauthorizedException("Invalid credentials");
        }
        UserAccount user = account.get();
        if (!user.isEnabled()) {
            loginThrottleService.recordAttempt(normalized, identifierType, false, ACCOUNT_DISABLED, device);
            throw new UnauthorizedException("Invalid credentials");
        }

        loginThrottleService.recordAttempt(normalized, identifierType, true, null, device);
        String role = user.getRole().wireName();
        TokenPair tokens = sessionTokenService.issue(user.getId(), role, user.getEmail(), device);

        LoginRiskAssessment assessment = suspiciousLoginService.evaluateAndAlert(LoginContext.builder()
                .userId(user.getId())
                .userRole(role)
                .identifier(normalized)
                .email(user.getEmail())
                .phone(user.getPhone())
                .device(device)
                .build());
        rememberDevice(user, role, device);

        log.info("Login succeeded: userId={}, role={}, risk={}", user.getId(), role, assessment.status());
        return new LoginResult(user.getId(), role, tokens, assessment);
    }

    public TokenPair refresh(String refreshToken, DeviceContext device) {
        TokenPair pair = sessionTokenService.rotate(refreshToken, device);
        if (pair == null) {
            throw new UnauthorizedException("Invalid refresh token");
        }
        return pair;
    }

    public int logout(UserPrincipal principal) {
        return sessionTokenService.revokeFamily(principal.getTokenFamily(), "User logout");
    }

    public int logoutAll(UserPrincipal principal) {
        return sessionTokenService.revokeAll(principal.getUserId(), "User logout from all devices");
    }

    static String identifierType(String identifier) {
        if (identifier.contains("@")) {
            return IDENTIFIER_EMAIL;
        }
        if (identifier.matches("\\+?[0-9][0-9 \\-]{5,}")) {
            return IDENTIFIER_PHONE;
        }
        return IDENTIFIER_USER_ID;
    }

    private Optional<UserAccount> findAccount(String identifier, String identifierType) {
        switch (identifierType) {
            case IDENTIFIER_EMAIL:
                return userAccountRepository.findByEmailIgnoreCase(identifier);
            case IDENTIFIER_PHONE:
                return userAccountRepository.findByPhone(identifier);
            default:
                return userAccountRepository.findById(identifier);
        }
    }

    private void rememberDevice(UserAccount user, String role, DeviceContext device) {
        try {
            deviceHistoryService.recordDevice(user.getId(), role, device);
        } catch (RuntimeException e) {
            log.warn("Device history not updated for userId={}: {}", user.getId(), e.getMessage());
        }
    }
}
