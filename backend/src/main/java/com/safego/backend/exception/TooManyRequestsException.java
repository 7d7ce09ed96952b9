package com.safego.backend.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Login refused by the throttle. Carries the instant the caller may retry.
 */
@Getter
public class TooManyRequestsException extends RuntimeException {

    private final Instant retryAt;
    private final long retryAfterSeconds;

    public TooManyRequestsException(String message, Instant retryAt, long retryAfterSeconds) {
        super(message);
        this.retryAt = retryAt;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
