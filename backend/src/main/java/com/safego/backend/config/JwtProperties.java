package com.safego.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "safego.jwt")
@Data
public class JwtProperties {

    /**
     * HMAC signing secret, at least 32 characters. Startup fails without it.
     */
    private String secret;

    /**
     * Key for the stored token hashes. Falls back to the signing secret when blank.
     */
    private String tokenHashSecret;

    private String issuer = "safego";
    private Duration accessTtl = Duration.ofMinutes(15);
    private Duration refreshTtl = Duration.ofDays(7);
    private long retentionSweepIntervalMs = 3_600_000L;
}
