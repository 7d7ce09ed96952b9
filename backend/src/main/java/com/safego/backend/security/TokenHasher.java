package com.safego.backend.security;

import com.safego.backend.config.JwtProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * Keyed hash of raw tokens for storage and lookup. The raw token is never persisted.
 */
@Component
public class TokenHasher {

    private static final String ALGORITHM = "HmacSHA256";

    private final JwtProperties jwtProperties;
    private SecretKeySpec key;

    public TokenHasher(JwtProperties jwtProperties) {
        this.jwtProperties = jwtProperties;
    }

    @PostConstruct
    public void init() {
        String secret = jwtProperties.getTokenHashSecret();
        if (secret == null || secret.isBlank()) {
            secret = jwtProperties.getSecret();
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Token hash secret is not configured");
        }
        key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String hash(String token) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(token.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to hash token", e);
        }
    }
}
