package com.safego.backend.dto;

public record SecurityDashboard(long activeSessions,
                                long activeLoginBlocks,
                                long loginAttemptsToday,
                                long failedLoginsToday,
                                long alertsToday,
                                long unacknowledgedAlerts,
                                long activeDevicesThisWeek,
                                long auditEventsToday) {
}
