package com.safego.backend.service;

import com.safego.backend.config.LoginThrottleProperties;
import com.safego.backend.dto.DeviceContext;
import com.safego.backend.dto.LoginAttemptView;
import com.safego.backend.dto.ThrottleDecision;
import com.safego.backend.model.LoginAttempt;
import com.safego.backend.repository.LoginAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.safego.backend.repository.LoginAttemptSpecifications.activeBlock;
import static com.safego.backend.repository.LoginAttemptSpecifications.blockRow;
import static com.safego.backend.repository.LoginAttemptSpecifications.createdAfter;
import static com.safego.backend.repository.LoginAttemptSpecifications.failedAttempt;
import static com.safego.backend.repository.LoginAttemptSpecifications.matchesSubject;
import static com.safego.backend.repository.LoginAttemptSpecifications.recordedAfter;

/**
 * Two-tier login throttle keyed on identifier, device id and device fingerprint.
 * <p>
 * Failures are counted inside the sliding window and after the identifier's latest successful
 * login. A new block needs at least one failure recorded after the latest block row, so an expired
 * block is not re-issued for the same failures.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginThrottleService {

    public static final String HARD_LOCK_REASON = "Account locked after repeated failed login attempts";
    public static final String COOLDOWN_REASON = "Too many failed login attempts, try again later";

    private final LoginAttemptRepository loginAttemptRepository;
    private final LoginThrottleProperties properties;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;
    private final Clock clock;

    @Transactional
    public ThrottleDecision check(String identifier, String identifierType, DeviceContext device) {
        DeviceContext context = device == null ? DeviceContext.empty() : device;
        Instant now = clock.instant();
        Specification<LoginAttempt> subject = matchesSubject(identifier, context.getDeviceId(), context.getDeviceFingerprint());

        Optional<LoginAttempt> activeBlock = first(subject.and(blockRow()).and(activeBlock(now)), "blockedUntil");
        if (activeBlock.isPresent()) {
            LoginAttempt block = activeBlock.get();
            metricsService.recordThrottleDenial("active_block");
            log.debug("Login denied by active block: identifier={}, until={}", identifier, block.getBlockedUntil());
            return HARD_LOCK_REASON.equals(block.getBlockReason())
                    ? ThrottleDecision.locked(block.getBlockedUntil(), block.getBlockReason())
                    : ThrottleDecision.cooldown(block.getBlockedUntil(), block.getBlockReason());
        }

        Instant since = countingStart(identifier, now);
        Specification<LoginAttempt> windowFailures = subject.and(failedAttempt()).and(createdAfter(since));
        long failures = loginAttemptRepository.count(windowFailures);
        boolean freshFailures = first(subject.and(blockRow()).and(createdAfter(since)), "id")
                .map(lastBlock -> loginAttemptRepository.count(windowFailures.and(recordedAfter(lastBlock.getId()))) > 0)
                .orElse(true);

        if (failures >= properties.getHardLockThreshold() && freshFailures) {
            Instant until = now.plus(properties.getHardLockDuration());
            writeBlock(identifier, identifierType, context, failures, until, HARD_LOCK_REASON, now);
            metricsService.recordThrottleDenial("hard_lock");
            log.info("Hard lock applied: identifier={}, failures={}, until={}", identifier, failures, until);
            return ThrottleDecision.locked(until, HARD_LOCK_REASON);
        }
        if (failures >= properties.getCooldownThreshold() && freshFailures) {
            Instant until = now.plus(properties.getCooldownDuration());
            writeBlock(identifier, identifierType, context, failures, until, COOLDOWN_REASON, now);
            metricsService.recordThrottleDenial("cooldown");
            log.info("Cooldown applied: identifier={}, failures={}, until={}", identifier, failures, until);
            return ThrottleDecision.cooldown(until, COOLDOWN_REASON);
        }
        return ThrottleDecision.allow(remaining(failures));
    }

    @Transactional
    public LoginAttempt recordAttempt(String identifier, String identifierType, boolean success,
                                      String failureReason, DeviceContext device) {
        DeviceContext context = device == null ? DeviceContext.empty() : device;
        Instant now = clock.instant();
        LoginAttempt attempt = loginAttemptRepository.save(LoginAttempt.builder()
                .identifier(identifier)
                .identifierType(identifierType)
                .attemptType(LoginAttempt.ATTEMPT_TYPE_LOGIN)
                .success(success)
                .failureReason(success ? null : failureReason)
                .deviceId(context.getDeviceId())
                .deviceFingerprint(context.getDeviceFingerprint())
                .ipAddress(context.getIpAddress())
                .userAgent(context.getUserAgent())
                .createdAt(now)
                .build());
        if (success) {
            int cleared = loginAttemptRepository.unblockActiveForIdentifier(identifier, now);
            if (cleared > 0) {
                log.info("Cleared {} block(s) after successful login: identifier={}", cleared, identifier);
            }
        }
        return attempt;
    }

    @Transactional
    public int clearBlocks(String identifier, String adminId) {
        int cleared = loginAttemptRepository.unblockAllForIdentifier(identifier);
        auditEventService.recordEvent(adminId, "security", "LOGIN_BLOCKS_CLEARED",
                AuditEventService.SEVERITY_WARNING, "Cleared login blocks for " + identifier,
                Map.of("identifier", identifier, "count", cleared));
        log.info("Admin {} cleared {} login block(s) for identifier={}", adminId, cleared, identifier);
        return cleared;
    }

    @Transactional(readOnly = true)
    public List<LoginAttemptView> listAttempts(String identifier, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 500)));
        List<LoginAttempt> attempts = identifier == null || identifier.isBlank()
                ? loginAttemptRepository.findAllByOrderByCreatedAtDesc(page)
                : loginAttemptRepository.findByIdentifierOrderByCreatedAtDesc(identifier, page);
        return attempts.stream().map(LoginAttemptView::from).collect(Collectors.toList());
    }

    private Instant countingStart(String identifier, Instant now) {
        Instant windowStart = now.minus(properties.getWindow());
        if (identifier == null || identifier.isBlank()) {
            return windowStart;
        }
        return loginAttemptRepository.findFirstByIdentifierAndSuccessTrueAndBlockReasonIsNullOrderByCreatedAtDesc(identifier)
                .map(LoginAttempt::getCreatedAt)
                .filter(lastSuccess -> lastSuccess.isAfter(windowStart))
                .orElse(windowStart);
    }

    private int remaining(long failures) {
        long limit = failures < properties.getCooldownThreshold()
                ? properties.getCooldownThreshold()
                : properties.getHardLockThreshold();
        return (int) Math.max(0, limit - failures);
    }

    private Optional<LoginAttempt> first(Specification<LoginAttempt> spec, String sortProperty) {
        return loginAttemptRepository.findAll(spec, PageRequest.of(0, 1, Sort.by(Sort.Direction.DESC, sortProperty)))
                .stream()
                .findFirst();
    }

    private void writeBlock(String identifier, String identifierType, DeviceContext device, long failures,
                            Instant until, String reason, Instant now) {
        loginAttemptRepository.save(LoginAttempt.builder()
                .identifier(identifier)
                .identifierType(identifierType)
                .attemptType(LoginAttempt.ATTEMPT_TYPE_LOGIN)
                .success(false)
                .deviceId(device.getDeviceId())
                .deviceFingerprint(device.getDeviceFingerprint())
                .ipAddress(device.getIpAddress())
                .userAgent(device.getUserAgent())
                .blocked(true)
                .blockedUntil(until)
                .blockReason(reason)
                .attemptCount((int) failures)
                .createdAt(now)
                .build());
    }
}
