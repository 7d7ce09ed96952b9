package com.safego.backend.security;

import com.safego.backend.config.JwtProperties;
import com.safego.backend.util.MutableClock;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.MalformedJwtException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    private MutableClock clock;
    private JwtTokenProvider provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MutableClock.DEFAULT_START);
        provider = new JwtTokenProvider(properties(SECRET, "safego"), clock);
        provider.validateSecret();
    }

    @Test
    void accessTokenCarriesSessionClaims() {
        Instant now = clock.instant();
        String token = provider.sign(new AccessTokenClaims("jti-1", "driver-7", "driver", "d7@safego.test",
                "family-1", 3, now, now.plus(Duration.ofMinutes(15))));

        TokenClaims claims = provider.parse(token);

        assertThat(claims).isInstanceOf(AccessTokenClaims.class);
        AccessTokenClaims access = (AccessTokenClaims) claims;
        assertThat(access.userId()).isEqualTo("driver-7");
        assertThat(access.userRole()).isEqualTo("driver");
        assertThat(access.email()).isEqualTo("d7@safego.test");
        assertThat(access.tokenFamily()).isEqualTo("family-1");
        assertThat(access.tokenVersion()).isEqualTo(3);
        assertThat(access.type()).isEqualTo("access");
    }

    @Test
    void refreshTokenParsesAsRefreshType() {
        Instant now = clock.instant();
        String token = provider.sign(new RefreshTokenClaims("jti-2", "cust-1", "customer", null,
                "family-2", 1, now, now.plus(Duration.ofDays(7))));

        assertThat(provider.parse(token)).isInstanceOf(RefreshTokenClaims.class);
    }

    @Test
    void expiredTokenIsRejected() {
        Instant now = clock.instant();
        String token = provider.sign(new AccessTokenClaims("jti-3", "cust-1", "customer", null,
                "family-3", 1, now, now.plus(Duration.ofMinutes(15))));

        clock.advance(Duration.ofMinutes(16));

        assertThatThrownBy(() -> provider.parse(token)).isInstanceOf(ExpiredJwtException.class);
    }

    @Test
    void tokenFromAnotherKeyOrIssuerIsRejected() {
        Instant now = clock.instant();
        AccessTokenClaims claims = new AccessTokenClaims("jti-4", "cust-1", "customer", null,
                "family-4", 1, now, now.plus(Duration.ofMinutes(15)));

        JwtTokenProvider otherKey = new JwtTokenProvider(properties("ffffffffffffffffffffffffffffffff", "safego"), clock);
        otherKey.validateSecret();
        JwtTokenProvider otherIssuer = new JwtTokenProvider(properties(SECRET, "someone-else"), clock);
        otherIssuer.validateSecret();

        assertThatThrownBy(() -> provider.parse(otherKey.sign(claims))).isInstanceOf(JwtException.class);
        assertThatThrownBy(() -> provider.parse(otherIssuer.sign(claims))).isInstanceOf(JwtException.class);
    }

    @Test
    void blankTokenIsMalformed() {
        assertThatThrownBy(() -> provider.parse(" ")).isInstanceOf(MalformedJwtException.class);
    }

    @Test
    void shortOrMissingSecretFailsStartup() {
        JwtTokenProvider missing = new JwtTokenProvider(properties(null, "safego"), clock);
        JwtTokenProvider tooShort = new JwtTokenProvider(properties("short-secret", "safego"), clock);

        assertThatThrownBy(missing::validateSecret).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(tooShort::validateSecret).isInstanceOf(IllegalStateException.class);
    }

    private static JwtProperties properties(String secret, String issuer) {
        JwtProperties properties = new JwtProperties();
        properties.setSecret(secret);
        properties.setIssuer(issuer);
        return properties;
    }
}
