package com.safego.backend.repository;

import com.safego.backend.model.AuthToken;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class AuthTokenRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private AuthTokenRepository authTokenRepository;

    @Test
    void markConsumedSucceedsOnlyOnce() {
        AuthToken token = entityManager.persistAndFlush(token("user-1", "family-a", 1, "a1", NOW.plus(Duration.ofDays(7))));

        assertThat(authTokenRepository.markConsumed(token.getId(), NOW, "Token rotated")).isEqualTo(1);
        assertThat(authTokenRepository.markConsumed(token.getId(), NOW, "Token rotated")).isZero();

        AuthToken reloaded = authTokenRepository.findById(token.getId()).orElseThrow();
        assertThat(reloaded.getUsedAt()).isEqualTo(NOW);
        assertThat(reloaded.isRevoked()).isTrue();
        assertThat(authTokenRepository.existsByTokenFamilyAndRevokedTrue("family-a")).isTrue();
    }

    @Test
    void revokeAllActiveForUserLeavesOtherUsersAlone() {
        entityManager.persist(token("user-1", "family-a", 1, "a1", NOW.plus(Duration.ofDays(7))));
        entityManager.persist(token("user-1", "family-b", 1, "b1", NOW.plus(Duration.ofDays(7))));
        entityManager.persist(token("user-2", "family-c", 1, "c1", NOW.plus(Duration.ofDays(7))));
        entityManager.flush();

        assertThat(authTokenRepository.revokeAllActiveForUser("user-1", NOW, "manual")).isEqualTo(2);
        assertThat(authTokenRepository.findByUserIdAndRevokedFalseAndRefreshExpiresAtAfterOrderByCreatedAtDesc("user-1", NOW))
                .isEmpty();
        assertThat(authTokenRepository.findByUserIdAndRevokedFalseAndRefreshExpiresAtAfterOrderByCreatedAtDesc("user-2", NOW))
                .hasSize(1);
    }

    @Test
    void deleteByRefreshExpiresAtBeforeKeepsLiveRecords() {
        entityManager.persist(token("user-1", "family-a", 1, "a1", NOW.minus(Duration.ofHours(1))));
        entityManager.persist(token("user-1", "family-b", 1, "b1", NOW.plus(Duration.ofHours(1))));
        entityManager.flush();

        assertThat(authTokenRepository.deleteByRefreshExpiresAtBefore(NOW)).isEqualTo(1);
        assertThat(authTokenRepository.findByUserIdOrderByCreatedAtDesc("user-1"))
                .extracting(AuthToken::getTokenFamily)
                .containsExactly("family-b");
    }

    private static AuthToken token(String userId, String family, int version, String hashSeed, Instant refreshExpiresAt) {
        return AuthToken.builder()
                .userId(userId)
                .userRole("customer")
                .accessTokenHash("access-" + hashSeed)
                .refreshTokenHash("refresh-" + hashSeed)
                .tokenFamily(family)
                .tokenVersion(version)
                .accessExpiresAt(NOW.plus(Duration.ofMinutes(15)))
                .refreshExpiresAt(refreshExpiresAt)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
