package com.safego.backend.dto;

import com.safego.backend.model.NegativeBalance;

import java.math.BigDecimal;
import java.time.Instant;

public record NegativeBalanceView(String ownerType,
                                  String ownerId,
                                  String countryCode,
                                  BigDecimal currentBalance,
                                  long totalCashTransactions,
                                  BigDecimal totalCashCollected,
                                  BigDecimal totalCommissionDue,
                                  BigDecimal totalOnlineSettled,
                                  boolean restricted,
                                  Instant restrictedAt,
                                  String restrictionReason,
                                  Instant lastUpdated) {

    public static NegativeBalanceView from(NegativeBalance balance) {
        return new NegativeBalanceView(balance.getOwnerType().name().toLowerCase(), balance.getOwnerId(),
                balance.getCountryCode(), balance.getCurrentBalance(), balance.getTotalCashTransactions(),
                balance.getTotalCashCollected(), balance.getTotalCommissionDue(), balance.getTotalOnlineSettled(),
                balance.isRestricted(), balance.getRestrictedAt(), balance.getRestrictionReason(),
                balance.getLastUpdated());
    }
}
