package com.safego.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "safego.suspicious-login")
@Data
public class SuspiciousLoginProperties {

    private boolean enabled = true;
    private List<String> highRiskCountries = new ArrayList<>(List.of("KP", "IR", "SY", "CU"));
    private Duration rapidIpWindow = Duration.ofHours(1);
    private int rapidIpThreshold = 3;
    private int deviceHistoryLimit = 10;
}
