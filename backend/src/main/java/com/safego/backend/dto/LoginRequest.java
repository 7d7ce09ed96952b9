package com.safego.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    @Size(max = 255)
    @Schema(description = "Email, phone number or user id")
    private String identifier;

    @NotBlank
    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY)
    private String password;

    @Size(max = 128)
    private String deviceId;

    @Size(max = 256)
    private String deviceFingerprint;

    private String deviceName;
    private String deviceModel;
    private String osName;
    private String osVersion;
    private String appVersion;
    private String platform;

    @Size(max = 2)
    @Schema(description = "ISO 3166-1 alpha-2 country resolved for the client IP")
    private String country;

    private String city;
}
