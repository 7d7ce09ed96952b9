package com.safego.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Application Configuration
 * Defines core beans shared by the authentication and settlement services
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * UTC system clock. Tests replace it to move time across throttle windows and token expiry.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
