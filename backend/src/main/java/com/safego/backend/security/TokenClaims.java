package com.safego.backend.security;

import java.time.Instant;

/**
 * Verified payload of a SafeGo token. Access and refresh payloads are distinct types, so code
 * that needs a refresh token cannot be handed an access token by accident.
 */
public sealed interface TokenClaims permits AccessTokenClaims, RefreshTokenClaims {

    String TYPE_CLAIM = "type";

    String tokenId();

    String userId();

    String userRole();

    String email();

    String tokenFamily();

    int tokenVersion();

    Instant issuedAt();

    Instant expiresAt();

    /**
     * Value of the {@code type} claim.
     */
    String type();
}
