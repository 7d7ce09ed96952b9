package com.safego.backend.dto;

import com.safego.backend.model.AuthToken;

import java.time.Instant;

/**
 * A stored session as shown to users and admins. Token hashes are never exposed.
 */
public record SessionSummary(Long id,
                             String userId,
                             String userRole,
                             String tokenFamily,
                             int tokenVersion,
                             Instant createdAt,
                             Instant accessExpiresAt,
                             Instant refreshExpiresAt,
                             Instant usedAt,
                             boolean revoked,
                             Instant revokedAt,
                             String revokedReason,
                             boolean reuseDetected,
                             String deviceId,
                             String ipAddress,
                             String userAgent) {

    public static SessionSummary from(AuthToken token) {
        return new SessionSummary(token.getId(), token.getUserId(), token.getUserRole(), token.getTokenFamily(),
                token.getTokenVersion(), token.getCreatedAt(), token.getAccessExpiresAt(),
                token.getRefreshExpiresAt(), token.getUsedAt(), token.isRevoked(), token.getRevokedAt(),
                token.getRevokedReason(), token.isReuseDetected(), token.getDeviceId(), token.getIpAddress(),
                token.getUserAgent());
    }
}
