package com.safego.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "settlement_thresholds", uniqueConstraints = {
        @UniqueConstraint(name = "uk_settlement_threshold_owner_type", columnNames = {"owner_type", "threshold_type"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementThreshold {

    public static final String NEGATIVE_BALANCE_MAX = "negative_balance_max";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "owner_type", nullable = false, length = 16)
    private OwnerType ownerType;

    @Column(name = "threshold_type", nullable = false, length = 64)
    private String thresholdType;

    @Column(name = "threshold_value", nullable = false, precision = 14, scale = 2)
    private BigDecimal thresholdValue;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "updated_by", length = 64)
    private String updatedBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
