package com.safego.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "device_history", uniqueConstraints = {
        @UniqueConstraint(name = "uk_device_history_user_device", columnNames = {"user_id", "device_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "user_role", length = 32)
    private String userRole;

    @Column(name = "device_id", nullable = false, length = 128)
    private String deviceId;

    @Column(name = "device_name")
    private String deviceName;

    @Column(name = "device_model")
    private String deviceModel;

    @Column(name = "os_name", length = 64)
    private String osName;

    @Column(name = "os_version", length = 64)
    private String osVersion;

    @Column(name = "app_version", length = 64)
    private String appVersion;

    @Column(length = 32)
    private String platform;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "ip_country", length = 2)
    private String ipCountry;

    @Column(name = "ip_city")
    private String ipCity;

    @Column(name = "last_login_ip", length = 64)
    private String lastLoginIp;

    @Column(name = "login_count", nullable = false)
    private int loginCount;

    @Column(name = "risk_score", nullable = false)
    private int riskScore;

    @Column(name = "risk_factors", length = 512)
    private String riskFactors;

    @Column(name = "is_trusted", nullable = false)
    private boolean trusted;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "removed_by_user", nullable = false)
    private boolean removedByUser;

    @Column(name = "removed_at")
    private Instant removedAt;

    @Column(name = "first_seen_at", nullable = false)
    private Instant firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;
}
