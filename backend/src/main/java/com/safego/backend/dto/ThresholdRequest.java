package com.safego.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdRequest {

    @NotBlank
    private String ownerType;

    @NotNull
    @DecimalMin("0")
    private BigDecimal thresholdValue;

    @Builder.Default
    private boolean active = true;
}
