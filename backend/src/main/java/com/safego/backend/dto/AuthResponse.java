package com.safego.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthResponse(String accessToken,
                           String refreshToken,
                           String tokenType,
                           Instant accessExpiresAt,
                           Instant refreshExpiresAt,
                           String userId,
                           String role) {

    public static AuthResponse of(TokenPair pair, String userId, String role) {
        return new AuthResponse(pair.accessToken(), pair.refreshToken(), "Bearer", pair.accessExpiresAt(),
                pair.refreshExpiresAt(), userId, role);
    }
}
