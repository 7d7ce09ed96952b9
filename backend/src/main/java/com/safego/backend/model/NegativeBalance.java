package com.safego.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Commission owed on cash transactions. The balance grows only through accrual and shrinks only
 * through online settlement or an administrative adjustment.
 */
@MappedSuperclass
@Data
@NoArgsConstructor
public abstract class NegativeBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "country_code", length = 2)
    private String countryCode;

    @Column(name = "current_balance", nullable = false, precision = 14, scale = 2)
    private BigDecimal currentBalance = BigDecimal.ZERO;

    @Column(name = "total_cash_collected", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalCashCollected = BigDecimal.ZERO;

    @Column(name = "total_commission_due", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalCommissionDue = BigDecimal.ZERO;

    @Column(name = "total_online_settled", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalOnlineSettled = BigDecimal.ZERO;

    @Column(name = "is_restricted", nullable = false)
    private boolean restricted;

    @Column(name = "restricted_at")
    private Instant restrictedAt;

    @Column(name = "restriction_reason")
    private String restrictionReason;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    public abstract String getOwnerId();

    public abstract OwnerType getOwnerType();

    public abstract long getTotalCashTransactions();
}
