package com.safego.backend.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class SettlementRequiredException extends RuntimeException {

    private final BigDecimal balance;

    public SettlementRequiredException(String reason, BigDecimal balance) {
        super(reason);
        this.balance = balance;
    }
}
