package com.safego.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter tokensIssuedCounter;
    private Counter tokensRotatedCounter;
    private Counter rotationRejectedCounter;
    private Counter tokenReuseCounter;
    private Counter detectorSkippedCounter;

    @PostConstruct
    void init() {
        tokensIssuedCounter = Counter.builder("auth_tokens_issued_total").register(meterRegistry);
        tokensRotatedCounter = Counter.builder("auth_tokens_rotated_total").register(meterRegistry);
        rotationRejectedCounter = Counter.builder("auth_rotation_rejected_total").register(meterRegistry);
        tokenReuseCounter = Counter.builder("auth_token_reuse_detected_total").register(meterRegistry);
        detectorSkippedCounter = Counter.builder("suspicious_login_skipped_total").register(meterRegistry);
    }

    public void recordTokenIssued() {
        tokensIssuedCounter.increment();
    }

    public void recordTokenRotated() {
        tokensRotatedCounter.increment();
    }

    public void recordRotationRejected() {
        rotationRejectedCounter.increment();
    }

    public void recordTokenReuse() {
        tokenReuseCounter.increment();
    }

    public void recordThrottleDenial(String tier) {
        Counter.builder("login_throttle_denials_total")
                .tag("tier", tier)
                .register(meterRegistry)
                .increment();
    }

    public void recordSuspiciousLogin(String alertType) {
        Counter.builder("suspicious_logins_total")
                .tag("type", alertType == null ? "unknown" : alertType)
                .register(meterRegistry)
                .increment();
    }

    public void recordDetectorSkipped() {
        detectorSkippedCounter.increment();
    }

    public void recordSettlementRestriction(String ownerType) {
        Counter.builder("settlement_restrictions_total")
                .tag("owner_type", ownerType)
                .register(meterRegistry)
                .increment();
    }
}
