package com.safego.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP exposure of the auth API: browser origins, and which operational endpoints stay reachable
 * without a session.
 */
@Configuration
@ConfigurationProperties(prefix = "safego.security")
@Data
public class SecurityProperties {

    private Cors cors = new Cors();
    private boolean publicHealthEndpoint = true;
    private boolean publicApiDocs = true;

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedMethods = List.of("GET", "POST", "PUT", "OPTIONS");
        /** Throttle and correlation headers the rider, driver and restaurant apps read back. */
        private List<String> exposedHeaders = List.of("Retry-After",
                RequestCorrelationFilter.REQUEST_ID_HEADER, RequestCorrelationFilter.CORRELATION_ID_HEADER);
    }
}
