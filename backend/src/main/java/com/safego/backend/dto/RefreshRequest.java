package com.safego.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshRequest {

    @NotBlank
    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY)
    private String refreshToken;

    private String deviceId;
    private String deviceFingerprint;
}
