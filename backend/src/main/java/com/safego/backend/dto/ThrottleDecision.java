package com.safego.backend.dto;

import java.time.Instant;

/**
 * Outcome of a login throttle check. A denial carries either {@code lockedUntil} (hard lock)
 * or {@code cooldownUntil} (cooldown).
 */
public record ThrottleDecision(boolean allowed,
                               int remainingAttempts,
                               Instant lockedUntil,
                               Instant cooldownUntil,
                               String reason) {

    public static ThrottleDecision allow(int remainingAttempts) {
        return new ThrottleDecision(true, remainingAttempts, null, null, null);
    }

    public static ThrottleDecision locked(Instant until, String reason) {
        return new ThrottleDecision(false, 0, until, null, reason);
    }

    public static ThrottleDecision cooldown(Instant until, String reason) {
        return new ThrottleDecision(false, 0, null, until, reason);
    }

    public Instant retryAt() {
        return lockedUntil != null ? lockedUntil : cooldownUntil;
    }
}
