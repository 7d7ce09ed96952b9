package com.safego.backend.security;

import java.time.Instant;

public record RefreshTokenClaims(String tokenId,
                                 String userId,
                                 String userRole,
                                 String email,
                                 String tokenFamily,
                                 int tokenVersion,
                                 Instant issuedAt,
                                 Instant expiresAt) implements TokenClaims {

    public static final String TYPE = "refresh";

    @Override
    public String type() {
        return TYPE;
    }
}
