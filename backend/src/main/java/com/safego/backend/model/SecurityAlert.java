package com.safego.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "security_alerts", indexes = {
        @Index(name = "idx_security_alerts_user", columnList = "user_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "user_role", length = 32)
    private String userRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 32)
    private AlertType alertType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertSeverity severity;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, length = 1000)
    private String message;

    @Column(name = "trigger_device_id", length = 128)
    private String triggerDeviceId;

    @Column(name = "trigger_device_name")
    private String triggerDeviceName;

    @Column(name = "trigger_ip", length = 64)
    private String triggerIp;

    @Column(name = "trigger_country", length = 2)
    private String triggerCountry;

    @Column(name = "trigger_city")
    private String triggerCity;

    @Column(name = "trigger_user_agent", length = 512)
    private String triggerUserAgent;

    @Column(name = "previous_device_id", length = 128)
    private String previousDeviceId;

    @Column(name = "previous_ip", length = 64)
    private String previousIp;

    @Column(name = "previous_country", length = 2)
    private String previousCountry;

    @Column(name = "previous_city")
    private String previousCity;

    @Column(name = "previous_login_at")
    private Instant previousLoginAt;

    @Column(name = "email_sent", nullable = false)
    private boolean emailSent;

    @Column(name = "sms_sent", nullable = false)
    private boolean smsSent;

    @Column(name = "notified_at")
    private Instant notifiedAt;

    @Column(nullable = false)
    private boolean acknowledged;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "was_legitimate")
    private Boolean wasLegitimate;

    @Column(name = "reviewed_by", length = 64)
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "review_note", length = 1000)
    private String reviewNote;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
