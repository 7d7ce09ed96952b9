package com.safego.backend.dto;

import java.math.BigDecimal;

public record SettlementRestriction(boolean restricted, String reason, BigDecimal balance) {

    public static SettlementRestriction notRestricted() {
        return new SettlementRestriction(false, null, null);
    }

    public static SettlementRestriction notRestricted(BigDecimal balance) {
        return new SettlementRestriction(false, null, balance);
    }

    public static SettlementRestriction restricted(String reason, BigDecimal balance) {
        return new SettlementRestriction(true, reason, balance);
    }
}
