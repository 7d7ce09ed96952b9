package com.safego.backend.service;

import com.safego.backend.dto.NegativeBalanceView;
import com.safego.backend.dto.SettlementRestriction;
import com.safego.backend.dto.SettlementThresholdView;
import com.safego.backend.exception.BadRequestException;
import com.safego.backend.exception.ConflictException;
import com.safego.backend.exception.NotFoundException;
import com.safego.backend.model.DriverNegativeBalance;
import com.safego.backend.model.NegativeBalance;
import com.safego.backend.model.OwnerType;
import com.safego.backend.model.RestaurantNegativeBalance;
import com.safego.backend.model.SettlementThreshold;
import com.safego.backend.model.UserRole;
import com.safego.backend.repository.DriverNegativeBalanceRepository;
import com.safego.backend.repository.RestaurantNegativeBalanceRepository;
import com.safego.backend.repository.SettlementThresholdRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Negative balance ledger for drivers and restaurants and the restriction check that gates
 * accepting new work.
 * <p>
 * Only {@link #checkRestriction} sets the restriction flag. Balance changes never clear it; release is
 * an administrative action through {@link #clearRestriction}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementEnforcementService {

    private final DriverNegativeBalanceRepository driverBalanceRepository;
    private final RestaurantNegativeBalanceRepository restaurantBalanceRepository;
    private final SettlementThresholdRepository thresholdRepository;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;
    private final Clock clock;

    @Transactional
    public SettlementRestriction checkRestriction(String userId, String userRole) {
        Optional<OwnerType> ownerType = UserRole.fromWire(userRole).flatMap(UserRole::settlementOwner);
        if (ownerType.isEmpty()) {
            return SettlementRestriction.notRestricted();
        }
        OwnerType type = ownerType.get();
        Optional<NegativeBalance> found = findBalance(type, userId);
        if (found.isEmpty()) {
            return SettlementRestriction.notRestricted(BigDecimal.ZERO);
        }
        NegativeBalance balance = found.get();
        if (balance.isRestricted()) {
            return SettlementRestriction.restricted(balance.getRestrictionReason(), balance.getCurrentBalance());
        }

        Optional<SettlementThreshold> threshold = activeThreshold(type);
        if (threshold.isPresent() && balance.getCurrentBalance().compareTo(threshold.get().getThresholdValue()) > 0) {
            String reason = String.format("Negative balance %s exceeds settlement limit %s. Settle online to continue.",
                    balance.getCurrentBalance().toPlainString(), threshold.get().getThresholdValue().toPlainString());
            restrict(type, userId, reason, balance.getCurrentBalance());
            return SettlementRestriction.restricted(reason, balance.getCurrentBalance());
        }
        return SettlementRestriction.notRestricted(balance.getCurrentBalance());
    }

    /**
     * Adds commission owed on one cash trip or order, creating the ledger row on first use.
     */
    public NegativeBalanceView accrueCashCommission(OwnerType ownerType, String ownerId, BigDecimal commission,
                                                    BigDecimal cashAmount, String countryCode) {
        requirePositive(commission, "commission");
        BigDecimal cash = cashAmount == null ? BigDecimal.ZERO : cashAmount;
        if (cash.signum() < 0) {
            throw new BadRequestException("cashAmount must not be negative");
        }
        Instant now = clock.instant();
        if (accrue(ownerType, ownerId, commission, cash, now) == 0) {
            try {
                insertBalance(ownerType, ownerId, commission, cash, countryCode, now);
            } catch (DataIntegrityViolationException ex) {
                log.debug("Ledger row created concurrently: {} {}", ownerType, ownerId);
                accrue(ownerType, ownerId, commission, cash, now);
            }
        }
        log.debug("Accrued commission {} for {} {}", commission, ownerType, ownerId);
        return requireView(ownerType, ownerId);
    }

    public NegativeBalanceView creditOnlineSettlement(OwnerType ownerType, String ownerId, BigDecimal amount) {
        requirePositive(amount, "amount");
        Instant now = clock.instant();
        int updated = ownerType == OwnerType.DRIVER
                ? driverBalanceRepository.credit(ownerId, amount, now)
                : restaurantBalanceRepository.credit(ownerId, amount, now);
        if (updated == 0) {
            throw new NotFoundException("No settlement balance for " + ownerType.name().toLowerCase() + " " + ownerId);
        }
        log.info("Online settlement {} credited to {} {}", amount, ownerType, ownerId);
        return requireView(ownerType, ownerId);
    }

    /**
     * Administrative write-down. The delta must be negative: only cash commission accrual raises a balance.
     */
    public NegativeBalanceView adjustBalance(OwnerType ownerType, String ownerId, BigDecimal delta,
                                             String adminId, String reason) {
        if (delta == null || delta.signum() >= 0) {
            throw new BadRequestException("delta must be negative");
        }
        if (reason == null || reason.isBlank()) {
            throw new BadRequestException("reason is required");
        }
        Instant now = clock.instant();
        int updated = ownerType == OwnerType.DRIVER
                ? driverBalanceRepository.adjust(ownerId, delta, now)
                : restaurantBalanceRepository.adjust(ownerId, delta, now);
        if (updated == 0) {
            throw new NotFoundException("No settlement balance for " + ownerType.name().toLowerCase() + " " + ownerId);
        }
        auditEventService.recordEvent(adminId, "settlement", "BALANCE_ADJUSTED", AuditEventService.SEVERITY_WARNING,
                reason, ledgerMetadata(ownerType, ownerId, delta));
        return requireView(ownerType, ownerId);
    }

    /**
     * Releases a restriction. Refused while the balance is still above the active threshold.
     */
    @Transactional
    public NegativeBalanceView clearRestriction(OwnerType ownerType, String ownerId, String adminId) {
        NegativeBalance balance = findBalance(ownerType, ownerId)
                .orElseThrow(() -> new NotFoundException("No settlement balance for " + ownerType.name().toLowerCase() + " " + ownerId));
        if (!balance.isRestricted()) {
            return NegativeBalanceView.from(balance);
        }
        Optional<SettlementThreshold> threshold = activeThreshold(ownerType);
        if (threshold.isPresent() && balance.getCurrentBalance().compareTo(threshold.get().getThresholdValue()) > 0) {
            throw new ConflictException("Balance is still above the settlement limit");
        }
        Instant now = clock.instant();
        if (ownerType == OwnerType.DRIVER) {
            driverBalanceRepository.clearRestriction(ownerId, now);
        } else {
            restaurantBalanceRepository.clearRestriction(ownerId, now);
        }
        auditEventService.recordEvent(adminId, "settlement", "RESTRICTION_CLEARED", "Settlement restriction cleared",
                ledgerMetadata(ownerType, ownerId, balance.getCurrentBalance()));
        log.info("Admin {} cleared settlement restriction for {} {}", adminId, ownerType, ownerId);
        return requireView(ownerType, ownerId);
    }

    @Transactional(readOnly = true)
    public NegativeBalanceView getBalance(OwnerType ownerType, String ownerId) {
        return requireView(ownerType, ownerId);
    }

    @Transactional(readOnly = true)
    public List<NegativeBalanceView> listRestricted(OwnerType ownerType) {
        if (ownerType == OwnerType.DRIVER) {
            return driverBalanceRepository.findByRestrictedTrueOrderByRestrictedAtDesc().stream()
                    .map(NegativeBalanceView::from)
                    .collect(Collectors.toList());
        }
        return restaurantBalanceRepository.findByRestrictedTrueOrderByRestrictedAtDesc().stream()
                .map(NegativeBalanceView::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public SettlementThresholdView upsertThreshold(OwnerType ownerType, BigDecimal value, boolean active, String adminId) {
        if (value == null || value.signum() < 0) {
            throw new BadRequestException("thresholdValue must not be negative");
        }
        Instant now = clock.instant();
        SettlementThreshold threshold = thresholdRepository
                .findByOwnerTypeAndThresholdType(ownerType, SettlementThreshold.NEGATIVE_BALANCE_MAX)
                .orElseGet(() -> SettlementThreshold.builder()
                        .ownerType(ownerType)
                        .thresholdType(SettlementThreshold.NEGATIVE_BALANCE_MAX)
                        .createdAt(now)
                        .build());
        threshold.setThresholdValue(value);
        threshold.setActive(active);
        threshold.setUpdatedBy(adminId);
        threshold.setUpdatedAt(now);
        SettlementThreshold saved = thresholdRepository.save(threshold);
        auditEventService.recordEvent(adminId, "settlement", "THRESHOLD_UPDATED", "Settlement threshold updated",
                Map.of("ownerType", ownerType.name(), "thresholdValue", value, "active", active));
        return SettlementThresholdView.from(saved);
    }

    @Transactional(readOnly = true)
    public List<SettlementThresholdView> listThresholds() {
        return thresholdRepository.findAllByOrderByOwnerTypeAsc().stream()
                .map(SettlementThresholdView::from)
                .collect(Collectors.toList());
    }

    private void restrict(OwnerType type, String ownerId, String reason, BigDecimal balance) {
        Instant now = clock.instant();
        int flipped = type == OwnerType.DRIVER
                ? driverBalanceRepository.markRestricted(ownerId, now, reason)
                : restaurantBalanceRepository.markRestricted(ownerId, now, reason);
        if (flipped > 0) {
            metricsService.recordSettlementRestriction(type.name().toLowerCase());
            auditEventService.recordEvent(ownerId, "settlement", "RESTRICTED", AuditEventService.SEVERITY_WARNING,
                    reason, ledgerMetadata(type, ownerId, balance));
            log.info("Settlement restriction applied: {} {} balance={}", type, ownerId, balance);
        }
    }

    private int accrue(OwnerType type, String ownerId, BigDecimal commission, BigDecimal cash, Instant now) {
        return type == OwnerType.DRIVER
                ? driverBalanceRepository.accrue(ownerId, commission, cash, now)
                : restaurantBalanceRepository.accrue(ownerId, commission, cash, now);
    }

    private void insertBalance(OwnerType type, String ownerId, BigDecimal commission, BigDecimal cash,
                               String countryCode, Instant now) {
        if (type == OwnerType.DRIVER) {
            DriverNegativeBalance row = new DriverNegativeBalance();
            row.setDriverId(ownerId);
            row.setTotalCashTrips(1);
            fillNew(row, commission, cash, countryCode, now);
            driverBalanceRepository.saveAndFlush(row);
        } else {
            RestaurantNegativeBalance row = new RestaurantNegativeBalance();
            row.setRestaurantId(ownerId);
            row.setTotalCashOrders(1);
            fillNew(row, commission, cash, countryCode, now);
            restaurantBalanceRepository.saveAndFlush(row);
        }
    }

    private static void fillNew(NegativeBalance row, BigDecimal commission, BigDecimal cash, String countryCode, Instant now) {
        row.setCountryCode(countryCode);
        row.setCurrentBalance(commission);
        row.setTotalCommissionDue(commission);
        row.setTotalCashCollected(cash);
        row.setTotalOnlineSettled(BigDecimal.ZERO);
        row.setLastUpdated(now);
    }

    private Optional<NegativeBalance> findBalance(OwnerType type, String ownerId) {
        if (type == OwnerType.DRIVER) {
            return driverBalanceRepository.findByDriverId(ownerId).map(NegativeBalance.class::cast);
        }
        return restaurantBalanceRepository.findByRestaurantId(ownerId).map(NegativeBalance.class::cast);
    }

    private Optional<SettlementThreshold> activeThreshold(OwnerType type) {
        return thresholdRepository.findByOwnerTypeAndThresholdTypeAndActiveTrue(type, SettlementThreshold.NEGATIVE_BALANCE_MAX);
    }

    private NegativeBalanceView requireView(OwnerType type, String ownerId) {
        return findBalance(type, ownerId)
                .map(NegativeBalanceView::from)
                .orElseThrow(() -> new NotFoundException("No settlement balance for " + type.name().toLowerCase() + " " + ownerId));
    }

    private static void requirePositive(BigDecimal value, String field) {
        if (value == null || value.signum() <= 0) {
            throw new BadRequestException(field + " must be positive");
        }
    }

    private static Map<String, Object> ledgerMetadata(OwnerType type, String ownerId, BigDecimal amount) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ownerType", type.name());
        metadata.put("ownerId", ownerId);
        metadata.put("amount", amount);
        return metadata;
    }
}
