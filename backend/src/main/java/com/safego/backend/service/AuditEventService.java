package com.safego.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safego.backend.config.RequestCorrelationFilter;
import com.safego.backend.model.AuditEvent;
import com.safego.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Append-only security audit trail, stamped with the ids and client address of the current request.
 * A failed audit write is logged and never fails the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    public static final String SEVERITY_INFO = "info";
    public static final String SEVERITY_WARNING = "warning";
    public static final String SEVERITY_CRITICAL = "critical";

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void recordEvent(String userId, String eventType, String action, String description, Object metadata) {
        recordEvent(userId, eventType, action, SEVERITY_INFO, description, metadata);
    }

    public void recordEvent(String userId, String eventType, String action, String severity,
                            String description, Object metadata) {
        try {
            String payload = metadata == null ? null : objectMapper.writeValueAsString(metadata);
            AuditEvent event = AuditEvent.builder()
                    .userId(userId)
                    .eventType(eventType)
                    .action(action)
                    .severity(severity)
                    .description(description)
                    .metadata(payload)
                    .requestId(MDC.get(RequestCorrelationFilter.REQUEST_ID_KEY))
                    .correlationId(MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY))
                    .clientIp(MDC.get(RequestCorrelationFilter.CLIENT_IP_KEY))
                    .createdAt(clock.instant())
                    .build();
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.warn("Failed to record audit event {}:{} - {}", eventType, action, e.getMessage());
        }
    }
}
