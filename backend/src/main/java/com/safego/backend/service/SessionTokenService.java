package com.safego.backend.service;

import com.safego.backend.config.JwtProperties;
import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.SessionSummary;
import com.safego.backend.dto.TokenPair;
import com.safego.backend.model.AlertSeverity;
import com.safego.backend.model.AuthToken;
import com.safego.backend.model.FraudEvent;
import com.safego.backend.repository.AuthTokenRepository;
import com.safego.backend.security.AccessTokenClaims;
import com.safego.backend.security.JwtTokenProvider;
import com.safego.backend.security.RefreshTokenClaims;
import com.safego.backend.security.TokenClaims;
import com.safego.backend.security.TokenHasher;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Rotating refresh-token sessions.
 * <p>
 * Every login starts a token family at version 1. A refresh token is single use: rotation consumes
 * the current record with a conditional update and issues the next version in the same family.
 * Presenting a refresh token whose family already holds a revoked record is treated as theft and
 * revokes every session of the user.
 * <p>
 * All rejections return {@code null}. Callers never learn why a token was refused.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionTokenService {

    public static final String REASON_ROTATED = "Token rotated";
    public static final String REASON_REUSE = "token reuse detected";

    private final AuthTokenRepository authTokenRepository;
    private final JwtTokenProvider jwtTokenProvider;
    private final TokenHasher tokenHasher;
    private final JwtProperties jwtProperties;
    private final FraudEventService fraudEventService;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;
    private final Clock clock;

    @Transactional
    public TokenPair issue(String userId, String userRole, String email, DeviceContext device) {
        String tokenFamily = UUID.randomUUID().toString();
        TokenPair pair = persistPair(userId, userRole, email, tokenFamily, 1, orEmpty(device));
        metricsService.recordTokenIssued();
        log.info("Session issued: userId={}, family={}", userId, tokenFamily);
        return pair;
    }

    @Transactional
    public TokenPair rotate(String refreshToken, DeviceContext device) {
        RefreshTokenClaims claims = parseRefresh(refreshToken);
        if (claims == null) {
            metricsService.recordRotationRejected();
            return null;
        }

        String refreshHash = tokenHasher.hash(refreshToken);
        Optional<AuthToken> current = authTokenRepository
                .findByRefreshTokenHashAndTokenFamilyAndRevokedFalse(refreshHash, claims.tokenFamily());
        if (current.isEmpty()) {
            if (authTokenRepository.existsByTokenFamilyAndRevokedTrue(claims.tokenFamily())) {
                escalateReuse(claims, orEmpty(device));
            }
            metricsService.recordRotationRejected();
            return null;
        }

        AuthToken record = current.get();
        if (record.getUsedAt() != null) {
            log.info("Refresh token already consumed: family={}, version={}", record.getTokenFamily(), record.getTokenVersion());
            metricsService.recordRotationRejected();
            return null;
        }

        Instant now = clock.instant();
        if (authTokenRepository.markConsumed(record.getId(), now, REASON_ROTATED) == 0) {
            log.info("Concurrent rotation lost: family={}, version={}", record.getTokenFamily(), record.getTokenVersion());
            metricsService.recordRotationRejected();
            return null;
        }

        TokenPair pair = persistPair(record.getUserId(), record.getUserRole(), record.getUserEmail(),
                record.getTokenFamily(), record.getTokenVersion() + 1, inheritDevice(record, device));
        metricsService.recordTokenRotated();
        log.debug("Session rotated: family={}, version={}", pair.tokenFamily(), pair.tokenVersion());
        return pair;
    }

    /**
     * Returns the access payload when the token verifies and its stored record is still live.
     */
    @Transactional(readOnly = true)
    public AccessTokenClaims validate(String accessToken) {
        TokenClaims claims = parseQuietly(accessToken);
        if (!(claims instanceof AccessTokenClaims access)) {
            return null;
        }
        boolean live = authTokenRepository.findByAccessTokenHashAndRevokedFalse(tokenHasher.hash(accessToken)).isPresent();
        return live ? access : null;
    }

    @Transactional
    public int revokeAll(String userId, String reason) {
        int revoked = authTokenRepository.revokeAllActiveForUser(userId, clock.instant(), reason);
        log.info("Revoked {} session(s) for userId={}: {}", revoked, userId, reason);
        auditEventService.recordEvent(userId, "session", "REVOKE_ALL", "Revoked all sessions: " + reason,
                Map.of("count", revoked));
        return revoked;
    }

    @Transactional
    public int revokeFamily(String tokenFamily, String reason) {
        int revoked = authTokenRepository.revokeActiveInFamily(tokenFamily, clock.instant(), reason);
        log.info("Revoked {} record(s) in family={}: {}", revoked, tokenFamily, reason);
        return revoked;
    }

    @Transactional
    public int cleanupExpired() {
        int deleted = authTokenRepository.deleteByRefreshExpiresAtBefore(clock.instant());
        if (deleted > 0) {
            log.info("Token retention sweep deleted {} expired record(s)", deleted);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<SessionSummary> listTokens(String userId, boolean activeOnly) {
        List<AuthToken> tokens = activeOnly
                ? authTokenRepository.findByUserIdAndRevokedFalseAndRefreshExpiresAtAfterOrderByCreatedAtDesc(userId, clock.instant())
                : authTokenRepository.findByUserIdOrderByCreatedAtDesc(userId);
        return tokens.stream().map(SessionSummary::from).collect(Collectors.toList());
    }

    private TokenPair persistPair(String userId, String userRole, String email, String tokenFamily,
                                  int tokenVersion, DeviceContext device) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant accessExpiresAt = now.plus(jwtProperties.getAccessTtl());
        Instant refreshExpiresAt = now.plus(jwtProperties.getRefreshTtl());

        String accessToken = jwtTokenProvider.sign(new AccessTokenClaims(UUID.randomUUID().toString(), userId, userRole,
                email, tokenFamily, tokenVersion, now, accessExpiresAt));
        String refreshToken = jwtTokenProvider.sign(new RefreshTokenClaims(UUID.randomUUID().toString(), userId, userRole,
                email, tokenFamily, tokenVersion, now, refreshExpiresAt));

        AuthToken record = AuthToken.builder()
                .userId(userId)
                .userRole(userRole)
                .userEmail(email)
                .accessTokenHash(tokenHasher.hash(accessToken))
                .refreshTokenHash(tokenHasher.hash(refreshToken))
                .tokenFamily(tokenFamily)
                .tokenVersion(tokenVersion)
                .accessExpiresAt(accessExpiresAt)
                .refreshExpiresAt(refreshExpiresAt)
                .deviceId(device.getDeviceId())
                .deviceFingerprint(device.getDeviceFingerprint())
                .ipAddress(device.getIpAddress())
                .userAgent(device.getUserAgent())
                .createdAt(now)
                .updatedAt(now)
                .build();
        authTokenRepository.save(record);
        return new TokenPair(accessToken, refreshToken, tokenFamily, tokenVersion, accessExpiresAt, refreshExpiresAt);
    }

    private void escalateReuse(RefreshTokenClaims claims, DeviceContext device) {
        Instant now = clock.instant();
        authTokenRepository.flagReuseInFamily(claims.tokenFamily(), now);
        int revoked = authTokenRepository.revokeAllActiveForUser(claims.userId(), now, REASON_REUSE);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tokenFamily", claims.tokenFamily());
        metadata.put("tokenVersion", claims.tokenVersion());
        metadata.put("revokedSessions", revoked);
        metadata.put("ipAddress", device.getIpAddress());
        metadata.put("deviceId", device.getDeviceId());
        metadata.put("userAgent", device.getUserAgent());

        fraudEventService.record(claims.userId(), FraudEvent.TOKEN_REUSE, AlertSeverity.CRITICAL,
                "Refresh token reuse detected; all sessions revoked", metadata);
        auditEventService.recordEvent(claims.userId(), "security", "TOKEN_REUSE_DETECTED",
                AuditEventService.SEVERITY_CRITICAL, "Refresh token reuse detected", metadata);
        metricsService.recordTokenReuse();
        log.warn("Refresh token reuse detected: userId={}, family={}, revokedSessions={}",
                claims.userId(), claims.tokenFamily(), revoked);
    }

    private RefreshTokenClaims parseRefresh(String refreshToken) {
        TokenClaims claims = parseQuietly(refreshToken);
        return claims instanceof RefreshTokenClaims refresh ? refresh : null;
    }

    private TokenClaims parseQuietly(String token) {
        try {
            return jwtTokenProvider.parse(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            return null;
        }
    }

    private DeviceContext inheritDevice(AuthToken previous, DeviceContext supplied) {
        DeviceContext device = orEmpty(supplied);
        return device.toBuilder()
                .deviceId(firstNonBlank(device.getDeviceId(), previous.getDeviceId()))
                .deviceFingerprint(firstNonBlank(device.getDeviceFingerprint(), previous.getDeviceFingerprint()))
                .ipAddress(firstNonBlank(device.getIpAddress(), previous.getIpAddress()))
                .userAgent(firstNonBlank(device.getUserAgent(), previous.getUserAgent()))
                .build();
    }

    private static DeviceContext orEmpty(DeviceContext device) {
        return device == null ? DeviceContext.empty() : device;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred == null || preferred.isBlank() ? fallback : preferred;
    }
}
