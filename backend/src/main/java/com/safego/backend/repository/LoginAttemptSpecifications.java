package com.safego.backend.repository;

import com.safego.backend.model.LoginAttempt;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Criteria for throttle lookups. A request is matched by its identifier, its device id or its
 * device fingerprint, whichever are present.
 */
public final class LoginAttemptSpecifications {

    private LoginAttemptSpecifications() {
    }

    public static Specification<LoginAttempt> matchesSubject(String identifier, String deviceId, String deviceFingerprint) {
        return (root, query, cb) -> {
            List<Predicate> keys = new ArrayList<>();
            if (identifier != null && !identifier.isBlank()) {
                keys.add(cb.equal(root.get("identifier"), identifier));
            }
            if (deviceId != null && !deviceId.isBlank()) {
                keys.add(cb.equal(root.get("deviceId"), deviceId));
            }
            if (deviceFingerprint != null && !deviceFingerprint.isBlank()) {
                keys.add(cb.equal(root.get("deviceFingerprint"), deviceFingerprint));
            }
            if (keys.isEmpty()) {
                return cb.disjunction();
            }
            return cb.or(keys.toArray(new Predicate[0]));
        };
    }

    public static Specification<LoginAttempt> failedAttempt() {
        return (root, query, cb) -> cb.and(
                cb.isFalse(root.get("success")),
                cb.isNull(root.get("blockReason")));
    }

    public static Specification<LoginAttempt> blockRow() {
        return (root, query, cb) -> cb.isNotNull(root.get("blockReason"));
    }

    public static Specification<LoginAttempt> activeBlock(Instant now) {
        return (root, query, cb) -> cb.and(
                cb.isTrue(root.get("blocked")),
                cb.greaterThan(root.get("blockedUntil"), now));
    }

    public static Specification<LoginAttempt> createdAfter(Instant since) {
        return (root, query, cb) -> cb.greaterThan(root.get("createdAt"), since);
    }

    /** Rows inserted after the given row; ids are assigned in insertion order. */
    public static Specification<LoginAttempt> recordedAfter(Long id) {
        return (root, query, cb) -> cb.greaterThan(root.get("id"), id);
    }
}
