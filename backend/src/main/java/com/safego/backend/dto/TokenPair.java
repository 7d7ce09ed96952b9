package com.safego.backend.dto;

import java.time.Instant;

public record TokenPair(String accessToken,
                        String refreshToken,
                        String tokenFamily,
                        int tokenVersion,
                        Instant accessExpiresAt,
                        Instant refreshExpiresAt) {
}
