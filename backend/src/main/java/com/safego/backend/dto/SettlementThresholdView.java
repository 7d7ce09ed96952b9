package com.safego.backend.dto;

import com.safego.backend.model.SettlementThreshold;

import java.math.BigDecimal;
import java.time.Instant;

public record SettlementThresholdView(Long id,
                                      String ownerType,
                                      String thresholdType,
                                      BigDecimal thresholdValue,
                                      boolean active,
                                      String updatedBy,
                                      Instant updatedAt) {

    public static SettlementThresholdView from(SettlementThreshold threshold) {
        return new SettlementThresholdView(threshold.getId(), threshold.getOwnerType().name().toLowerCase(),
                threshold.getThresholdType(), threshold.getThresholdValue(), threshold.isActive(),
                threshold.getUpdatedBy(), threshold.getUpdatedAt());
    }
}
