package com.safego.backend.repository;

import com.safego.backend.model.AuthToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AuthTokenRepository extends JpaRepository<AuthToken, Long> {

    Optional<AuthToken> findByRefreshTokenHashAndTokenFamilyAndRevokedFalse(String refreshTokenHash, String tokenFamily);

    Optional<AuthToken> findByAccessTokenHashAndRevokedFalse(String accessTokenHash);

    boolean existsByTokenFamilyAndRevokedTrue(String tokenFamily);

    List<AuthToken> findByUserIdOrderByCreatedAtDesc(String userId);

    List<AuthToken> findByUserIdAndRevokedFalseAndRefreshExpiresAtAfterOrderByCreatedAtDesc(String userId, Instant now);

    long countByRevokedFalseAndRefreshExpiresAtAfter(Instant now);

    /**
     * Consumes a refresh token. Returns 1 for the single caller that wins, 0 for everyone else.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AuthToken t SET t.usedAt = :now, t.revoked = true, t.revokedAt = :now, " +
            "t.revokedReason = :reason, t.updatedAt = :now " +
            "WHERE t.id = :id AND t.usedAt IS NULL AND t.revoked = false")
    int markConsumed(@Param("id") Long id, @Param("now") Instant now, @Param("reason") String reason);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AuthToken t SET t.revoked = true, t.revokedAt = :now, t.revokedReason = :reason, t.updatedAt = :now " +
            "WHERE t.userId = :userId AND t.revoked = false")
    int revokeAllActiveForUser(@Param("userId") String userId, @Param("now") Instant now, @Param("reason") String reason);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AuthToken t SET t.revoked = true, t.revokedAt = :now, t.revokedReason = :reason, t.updatedAt = :now " +
            "WHERE t.tokenFamily = :family AND t.revoked = false")
    int revokeActiveInFamily(@Param("family") String tokenFamily, @Param("now") Instant now, @Param("reason") String reason);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AuthToken t SET t.reuseDetected = true, t.reuseDetectedAt = :now, t.updatedAt = :now " +
            "WHERE t.tokenFamily = :family")
    int flagReuseInFamily(@Param("family") String tokenFamily, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AuthToken t WHERE t.refreshExpiresAt < :now")
    int deleteByRefreshExpiresAtBefore(@Param("now") Instant now);
}
