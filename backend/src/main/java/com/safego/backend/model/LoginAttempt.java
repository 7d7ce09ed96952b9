package com.safego.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A login attempt, or a block derived from earlier attempts.
 * Rows with a non-null {@code blockReason} are blocks; all others are attempts.
 */
@Entity
@Table(name = "login_attempts", indexes = {
        @Index(name = "idx_login_attempts_identifier", columnList = "identifier, created_at"),
        @Index(name = "idx_login_attempts_device", columnList = "device_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginAttempt {

    public static final String ATTEMPT_TYPE_LOGIN = "login";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String identifier;

    @Column(name = "identifier_type", nullable = false, length = 16)
    private String identifierType;

    @Column(name = "attempt_type", nullable = false, length = 16)
    private String attemptType;

    @Column(nullable = false)
    private boolean success;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "device_id", length = 128)
    private String deviceId;

    @Column(name = "device_fingerprint", length = 256)
    private String deviceFingerprint;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "is_blocked", nullable = false)
    private boolean blocked;

    @Column(name = "blocked_until")
    private Instant blockedUntil;

    @Column(name = "block_reason")
    private String blockReason;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public boolean isBlockRow() {
        return blockReason != null;
    }

    public boolean isActiveBlock(Instant now) {
        return blocked && blockedUntil != null && blockedUntil.isAfter(now);
    }
}
