package com.safego.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "safego.rate-limit")
@Data
public class RateLimitProperties {

    private Login login = new Login();
    private Refresh refresh = new Refresh();

    @Data
    public static class Login {
        private int limitPerMinute = 20;
        private long timeoutMs = 0;
    }

    @Data
    public static class Refresh {
        private int limitPerMinute = 60;
        private long timeoutMs = 0;
    }
}
