package com.safego.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "safego.login-throttle")
@Data
public class LoginThrottleProperties {

    private Duration window = Duration.ofMinutes(15);
    private int cooldownThreshold = 5;
    private Duration cooldownDuration = Duration.ofMinutes(5);
    private int hardLockThreshold = 10;
    private Duration hardLockDuration = Duration.ofMinutes(30);
}
