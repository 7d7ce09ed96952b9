package com.safego.backend.service;

import com.safego.backend.config.SuspiciousLoginProperties;
import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.LoginContext;
import com.safego.backend.dto.LoginRiskAssessment;
import com.safego.backend.dto.SecurityAlertView;
import com.safego.backend.exception.BadRequestException;
import com.safego.backend.exception.NotFoundException;
import com.safego.backend.model.AlertSeverity;
import com.safego.backend.model.AlertType;
import com.safego.backend.model.DeviceHistory;
import com.safego.backend.model.SecurityAlert;
import com.safego.backend.repository.LoginAttemptRepository;
import com.safego.backend.repository.SecurityAlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies successful logins against the user's device and login history and raises
 * {@link SecurityAlert}s. Detection never blocks a login.
 * <p>
 * Rules are checked in {@link AlertType} declaration order and the first match wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuspiciousLoginService {

    static final String REVOKE_REASON = "Security alert reported as not legitimate";

    private final DeviceHistoryService deviceHistoryService;
    private final LoginAttemptRepository loginAttemptRepository;
    private final SecurityAlertRepository securityAlertRepository;
    private final SessionTokenService sessionTokenService;
    private final NotificationDispatcher notificationDispatcher;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;
    private final SuspiciousLoginProperties properties;
    private final Clock clock;

    public LoginRiskAssessment evaluate(LoginContext context) {
        DeviceContext device = deviceOf(context);
        List<DeviceHistory> history = deviceHistoryService.recentActiveDevices(context.getUserId(),
                properties.getDeviceHistoryLimit());

        String deviceId = device.getDeviceId();
        if (deviceId != null && !deviceId.isBlank()
                && history.stream().noneMatch(known -> deviceId.equals(known.getDeviceId()))) {
            return LoginRiskAssessment.suspicious(AlertType.NEW_DEVICE, AlertSeverity.MEDIUM,
                    "Login from a device not seen before");
        }

        String country = normalizeCountry(device.getCountry());
        Set<String> knownCountries = history.stream()
                .map(DeviceHistory::getIpCountry)
                .map(SuspiciousLoginService::normalizeCountry)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (country != null && !knownCountries.isEmpty() && !knownCountries.contains(country)) {
            return LoginRiskAssessment.suspicious(AlertType.NEW_COUNTRY, AlertSeverity.HIGH,
                    "Login from a new country: " + country);
        }

        if (context.getIdentifier() != null) {
            Instant since = clock.instant().minus(properties.getRapidIpWindow());
            Set<String> addresses = new HashSet<>(loginAttemptRepository.findDistinctSuccessfulIps(context.getIdentifier(), since));
            if (device.getIpAddress() != null) {
                addresses.add(device.getIpAddress());
            }
            if (addresses.size() >= properties.getRapidIpThreshold()) {
                return LoginRiskAssessment.suspicious(AlertType.RAPID_IP_CHANGE, AlertSeverity.HIGH,
                        addresses.size() + " different IP addresses within " + properties.getRapidIpWindow().toMinutes() + " minutes");
            }
        }

        if (isHighRisk(country)) {
            return LoginRiskAssessment.suspicious(AlertType.HIGH_RISK_LOCATION, AlertSeverity.CRITICAL,
                    "Login from high-risk location: " + country);
        }
        return LoginRiskAssessment.clear();
    }

    /**
     * Evaluates the login and raises an alert when it is suspicious. Any internal failure yields a
     * {@code SKIPPED} assessment instead of an exception.
     */
    public LoginRiskAssessment evaluateAndAlert(LoginContext context) {
        if (!properties.isEnabled()) {
            return LoginRiskAssessment.skipped("Suspicious login detection disabled");
        }
        try {
            LoginRiskAssessment assessment = evaluate(context);
            if (!assessment.isSuspicious()) {
                return assessment;
            }
            SecurityAlert alert = createSecurityAlert(context, assessment);
            return assessment.withAlertId(alert.getId());
        } catch (RuntimeException e) {
            metricsService.recordDetectorSkipped();
            log.warn("Suspicious login check skipped for userId={}: {}", context.getUserId(), e.getMessage());
            return LoginRiskAssessment.skipped(e.getClass().getSimpleName());
        }
    }

    public SecurityAlert createSecurityAlert(LoginContext context, LoginRiskAssessment assessment) {
        DeviceContext device = deviceOf(context);
        Instant now = clock.instant();
        SecurityAlert.SecurityAlertBuilder alert = SecurityAlert.builder()
                .userId(context.getUserId())
                .userRole(context.getUserRole())
                .alertType(assessment.alertType())
                .severity(assessment.severity())
                .title(titleFor(assessment.alertType()))
                .message(assessment.reason())
                .triggerDeviceId(device.getDeviceId())
                .triggerDeviceName(device.getDeviceName())
                .triggerIp(device.getIpAddress())
                .triggerCountry(normalizeCountry(device.getCountry()))
                .triggerCity(device.getCity())
                .triggerUserAgent(device.getUserAgent())
                .createdAt(now);

        deviceHistoryService.recentActiveDevices(context.getUserId(), 1).stream()
                .findFirst()
                .ifPresent(previous -> alert
                        .previousDeviceId(previous.getDeviceId())
                        .previousIp(previous.getLastLoginIp())
                        .previousCountry(previous.getIpCountry())
                        .previousCity(previous.getIpCity())
                        .previousLoginAt(previous.getLastSeenAt()));

        SecurityAlert saved = securityAlertRepository.save(alert.build());
        notify(saved, context);
        saved = securityAlertRepository.save(saved);

        boolean highRisk = isHighRisk(saved.getTriggerCountry());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("alertId", saved.getId());
        metadata.put("alertType", saved.getAlertType().wireName());
        metadata.put("ipAddress", saved.getTriggerIp());
        metadata.put("country", saved.getTriggerCountry());
        metadata.put("deviceId", saved.getTriggerDeviceId());
        auditEventService.recordEvent(context.getUserId(), "security", "SUSPICIOUS_LOGIN",
                highRisk ? AuditEventService.SEVERITY_CRITICAL : AuditEventService.SEVERITY_WARNING,
                saved.getTitle(), metadata);
        metricsService.recordSuspiciousLogin(saved.getAlertType().wireName());

        if (highRisk) {
            log.error("High-risk login: userId={}, country={}, alertId={}", context.getUserId(), saved.getTriggerCountry(), saved.getId());
        } else {
            log.warn("Suspicious login: userId={}, type={}, alertId={}", context.getUserId(), saved.getAlertType(), saved.getId());
        }
        return saved;
    }

    @Transactional
    public SecurityAlertView acknowledgeAlert(Long alertId, String userId, boolean wasLegitimate) {
        SecurityAlert alert = securityAlertRepository.findById(alertId)
                .filter(found -> found.getUserId().equals(userId))
                .orElseThrow(() -> new NotFoundException("Security alert not found"));
        alert.setAcknowledged(true);
        alert.setAcknowledgedAt(clock.instant());
        alert.setWasLegitimate(wasLegitimate);
        SecurityAlert saved = securityAlertRepository.save(alert);

        if (!wasLegitimate) {
            int revoked = sessionTokenService.revokeAll(userId, REVOKE_REASON);
            auditEventService.recordEvent(userId, "security", "ALERT_REPORTED_ILLEGITIMATE",
                    AuditEventService.SEVERITY_CRITICAL, "User reported login as not legitimate",
                    Map.of("alertId", alertId, "revokedSessions", revoked));
        }
        return SecurityAlertView.from(saved);
    }

    @Transactional
    public SecurityAlertView reviewAlert(Long alertId, String adminId, String reviewNote) {
        if (reviewNote == null || reviewNote.isBlank()) {
            throw new BadRequestException("reviewNote is required");
        }
        SecurityAlert alert = securityAlertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Security alert not found"));
        alert.setReviewedBy(adminId);
        alert.setReviewedAt(clock.instant());
        alert.setReviewNote(reviewNote);
        auditEventService.recordEvent(adminId, "security", "ALERT_REVIEWED", "Security alert reviewed",
                Map.of("alertId", alertId, "userId", alert.getUserId()));
        return SecurityAlertView.from(securityAlertRepository.save(alert));
    }

    @Transactional(readOnly = true)
    public List<SecurityAlertView> listAlerts(String userId, Boolean acknowledged, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 200)));
        List<SecurityAlert> alerts;
        if (userId == null) {
            alerts = acknowledged == null
                    ? securityAlertRepository.findAllByOrderByCreatedAtDesc(page)
                    : securityAlertRepository.findByAcknowledgedOrderByCreatedAtDesc(acknowledged, page);
        } else {
            alerts = acknowledged == null
                    ? securityAlertRepository.findByUserIdOrderByCreatedAtDesc(userId, page)
                    : securityAlertRepository.findByUserIdAndAcknowledgedOrderByCreatedAtDesc(userId, acknowledged, page);
        }
        return alerts.stream().map(SecurityAlertView::from).collect(Collectors.toList());
    }

    private void notify(SecurityAlert alert, LoginContext context) {
        String body = alert.getMessage() + ". If this was not you, review your devices and sign out of all sessions.";
        if (context.getEmail() != null && !context.getEmail().isBlank()) {
            alert.setEmailSent(send(new NotificationTemplate(NotificationTemplate.Channel.EMAIL, context.getEmail(),
                    "SafeGo security alert: " + alert.getTitle(), body)));
        }
        if (context.getPhone() != null && !context.getPhone().isBlank()) {
            alert.setSmsSent(send(new NotificationTemplate(NotificationTemplate.Channel.SMS, context.getPhone(),
                    alert.getTitle(), "SafeGo: " + body)));
        }
        if (alert.isEmailSent() || alert.isSmsSent()) {
            alert.setNotifiedAt(clock.instant());
        }
    }

    private boolean send(NotificationTemplate template) {
        try {
            notificationDispatcher.dispatch(template);
            return true;
        } catch (RuntimeException e) {
            log.warn("Security notification via {} failed: {}", template.channel(), e.getMessage());
            return false;
        }
    }

    private boolean isHighRisk(String country) {
        return country != null && properties.getHighRiskCountries().stream()
                .anyMatch(code -> code.equalsIgnoreCase(country));
    }

    private static String titleFor(AlertType type) {
        switch (type) {
            case NEW_DEVICE:
                return "New device sign-in";
            case NEW_COUNTRY:
                return "Sign-in from a new country";
            case RAPID_IP_CHANGE:
                return "Multiple sign-in locations";
            case HIGH_RISK_LOCATION:
                return "Sign-in from a high-risk location";
            default:
                return "Suspicious sign-in";
        }
    }

    private static DeviceContext deviceOf(LoginContext context) {
        return context.getDevice() == null ? DeviceContext.empty() : context.getDevice();
    }

    private static String normalizeCountry(String country) {
        return country == null || country.isBlank() ? null : country.trim().toUpperCase(Locale.ROOT);
    }
}
