package com.safego.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Cash commission accrual, online settlement credit or administrative adjustment.
 * {@code amount} is the commission, the credited amount or the negative adjustment delta respectively.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntryRequest {

    @NotBlank
    private String ownerType;

    @NotBlank
    private String ownerId;

    @NotNull
    private BigDecimal amount;

    private BigDecimal cashAmount;

    @Size(max = 2)
    private String countryCode;

    @Size(max = 255)
    private String reason;
}
