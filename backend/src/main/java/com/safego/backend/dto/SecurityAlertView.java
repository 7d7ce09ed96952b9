package com.safego.backend.dto;

import com.safego.backend.model.SecurityAlert;

import java.time.Instant;

public record SecurityAlertView(Long id,
                                String userId,
                                String alertType,
                                String severity,
                                String title,
                                String message,
                                String triggerDeviceId,
                                String triggerDeviceName,
                                String triggerIp,
                                String triggerCountry,
                                String triggerCity,
                                String previousDeviceId,
                                String previousIp,
                                String previousCountry,
                                Instant previousLoginAt,
                                boolean emailSent,
                                boolean smsSent,
                                boolean acknowledged,
                                Instant acknowledgedAt,
                                Boolean wasLegitimate,
                                String reviewedBy,
                                Instant reviewedAt,
                                String reviewNote,
                                Instant createdAt) {

    public static SecurityAlertView from(SecurityAlert alert) {
        return new SecurityAlertView(alert.getId(), alert.getUserId(), alert.getAlertType().wireName(),
                alert.getSeverity().wireName(), alert.getTitle(), alert.getMessage(), alert.getTriggerDeviceId(),
                alert.getTriggerDeviceName(), alert.getTriggerIp(), alert.getTriggerCountry(), alert.getTriggerCity(),
                alert.getPreviousDeviceId(), alert.getPreviousIp(), alert.getPreviousCountry(),
                alert.getPreviousLoginAt(), alert.isEmailSent(), alert.isSmsSent(), alert.isAcknowledged(),
                alert.getAcknowledgedAt(), alert.getWasLegitimate(), alert.getReviewedBy(), alert.getReviewedAt(),
                alert.getReviewNote(), alert.getCreatedAt());
    }
}
