package com.safego.backend.security;

import com.safego.backend.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * Signs and verifies SafeGo access and refresh tokens (HS256).
 */
@Slf4j
@Component
public class JwtTokenProvider {

    static final int MIN_SECRET_LENGTH = 32;

    private static final String ROLE_CLAIM = "role";
    private static final String EMAIL_CLAIM = "email";
    private static final String FAMILY_CLAIM = "family";
    private static final String VERSION_CLAIM = "ver";

    private final JwtProperties jwtProperties;
    private final Clock clock;
    private SecretKey signingKey;

    public JwtTokenProvider(JwtProperties jwtProperties, Clock clock) {
        this.jwtProperties = jwtProperties;
        this.clock = clock;
    }

    @PostConstruct
    public void validateSecret() {
        String secret = jwtProperties.getSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Missing JWT secret. Set safego.jwt.secret (JWT_SECRET).");
            throw new IllegalStateException("JWT signing secret is not configured");
        }
        if (secret.length() < MIN_SECRET_LENGTH) {
            log.error("JWT secret must be at least {} characters.", MIN_SECRET_LENGTH);
            throw new IllegalStateException("JWT signing secret is too short");
        }
        signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public String sign(TokenClaims claims) {
        JwtBuilder builder = Jwts.builder()
                .id(claims.tokenId())
                .issuer(jwtProperties.getIssuer())
                .subject(claims.userId())
                .claim(ROLE_CLAIM, claims.userRole())
                .claim(FAMILY_CLAIM, claims.tokenFamily())
                .claim(VERSION_CLAIM, claims.tokenVersion())
                .claim(TokenClaims.TYPE_CLAIM, claims.type())
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()));
        if (claims.email() != null) {
            builder.claim(EMAIL_CLAIM, claims.email());
        }
        return builder.signWith(signingKey, Jwts.SIG.HS256).compact();
    }

    /**
     * Verifies signature, issuer and expiry and returns the typed payload.
     *
     * @throws JwtException if the token is not a valid SafeGo token
     */
    public TokenClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedJwtException("Empty token");
        }
        Claims claims = Jwts.parser()
                .verifyWith(signingKey)
                .requireIssuer(jwtProperties.getIssuer())
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();

        String type = claims.get(TokenClaims.TYPE_CLAIM, String.class);
        Integer version = claims.get(VERSION_CLAIM, Integer.class);
        String family = claims.get(FAMILY_CLAIM, String.class);
        if (version == null || family == null || claims.getSubject() == null) {
            throw new MalformedJwtException("Token is missing session claims");
        }
        if (AccessTokenClaims.TYPE.equals(type)) {
            return new AccessTokenClaims(claims.getId(), claims.getSubject(), claims.get(ROLE_CLAIM, String.class),
                    claims.get(EMAIL_CLAIM, String.class), family, version,
                    claims.getIssuedAt().toInstant(), claims.getExpiration().toInstant());
        }
        if (RefreshTokenClaims.TYPE.equals(type)) {
            return new RefreshTokenClaims(claims.getId(), claims.getSubject(), claims.get(ROLE_CLAIM, String.class),
                    claims.get(EMAIL_CLAIM, String.class), family, version,
                    claims.getIssuedAt().toInstant(), claims.getExpiration().toInstant());
        }
        throw new MalformedJwtException("Unknown token type: " + type);
    }
}
