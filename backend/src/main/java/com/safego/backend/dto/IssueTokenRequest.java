package com.safego.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueTokenRequest {

    @NotBlank
    private String userId;

    @NotBlank
    private String userRole;

    private String email;
    private String deviceId;
    private String deviceFingerprint;
}
