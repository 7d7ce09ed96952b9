package com.safego.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safego.backend.model.AlertSeverity;
import com.safego.backend.model.FraudEvent;
import com.safego.backend.repository.FraudEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class FraudEventService {

    private final FraudEventRepository fraudEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FraudEvent record(String userId, String eventType, AlertSeverity severity, String description,
                             Map<String, Object> metadata) {
        FraudEvent event = FraudEvent.builder()
                .userId(userId)
                .eventType(eventType)
                .severity(severity)
                .description(description)
                .metadata(toJson(metadata))
                .createdAt(clock.instant())
                .build();
        return fraudEventRepository.save(event);
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Fraud event metadata not serializable: {}", e.getMessage());
            return metadata.toString();
        }
    }
}
