package com.safego.backend.service;

import com.safego.backend.dto.SecurityDashboard;
import com.safego.backend.repository.AuditEventRepository;
import com.safego.backend.repository.AuthTokenRepository;
import com.safego.backend.repository.DeviceHistoryRepository;
import com.safego.backend.repository.LoginAttemptRepository;
import com.safego.backend.repository.SecurityAlertRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Service
@RequiredArgsConstructor
public class SecurityDashboardService {

    private final AuthTokenRepository authTokenRepository;
    private final LoginAttemptRepository loginAttemptRepository;
    private final SecurityAlertRepository securityAlertRepository;
    private final DeviceHistoryRepository deviceHistoryRepository;
    private final AuditEventRepository auditEventRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public SecurityDashboard snapshot() {
        Instant now = clock.instant();
        Instant dayStart = now.truncatedTo(ChronoUnit.DAYS);
        Instant weekStart = now.minus(Duration.ofDays(7));
        return new SecurityDashboard(
                authTokenRepository.countByRevokedFalseAndRefreshExpiresAtAfter(now),
                loginAttemptRepository.countActiveBlocks(now),
                loginAttemptRepository.countByBlockReasonIsNullAndCreatedAtGreaterThanEqual(dayStart),
                loginAttemptRepository.countByBlockReasonIsNullAndSuccessFalseAndCreatedAtGreaterThanEqual(dayStart),
                securityAlertRepository.countByCreatedAtGreaterThanEqual(dayStart),
                securityAlertRepository.countByAcknowledgedFalse(),
                deviceHistoryRepository.countByActiveTrueAndLastSeenAtGreaterThanEqual(weekStart),
                auditEventRepository.countByCreatedAtGreaterThanEqual(dayStart)
        );
    }
}
