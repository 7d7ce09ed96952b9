package com.safego.backend.dto;

import com.safego.backend.model.LoginAttempt;

import java.time.Instant;

public record LoginAttemptView(Long id,
                               String identifier,
                               String identifierType,
                               boolean success,
                               String failureReason,
                               String deviceId,
                               String ipAddress,
                               boolean blocked,
                               Instant blockedUntil,
                               String blockReason,
                               int attemptCount,
                               Instant createdAt) {

    public static LoginAttemptView from(LoginAttempt attempt) {
        return new LoginAttemptView(attempt.getId(), attempt.getIdentifier(), attempt.getIdentifierType(),
                attempt.isSuccess(), attempt.getFailureReason(), attempt.getDeviceId(), attempt.getIpAddress(),
                attempt.isBlocked(), attempt.getBlockedUntil(), attempt.getBlockReason(), attempt.getAttemptCount(),
                attempt.getCreatedAt());
    }
}
