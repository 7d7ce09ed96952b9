package com.safego.backend.repository;

import com.safego.backend.model.LoginAttempt;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface LoginAttemptRepository extends JpaRepository<LoginAttempt, Long>, JpaSpecificationExecutor<LoginAttempt> {

    Optional<LoginAttempt> findFirstByIdentifierAndSuccessTrueAndBlockReasonIsNullOrderByCreatedAtDesc(String identifier);

    List<LoginAttempt> findByIdentifierOrderByCreatedAtDesc(String identifier, Pageable pageable);

    List<LoginAttempt> findAllByOrderByCreatedAtDesc(Pageable pageable);

    @Query("SELECT DISTINCT a.ipAddress FROM LoginAttempt a WHERE a.identifier = :identifier " +
            "AND a.success = true AND a.blockReason IS NULL AND a.ipAddress IS NOT NULL AND a.createdAt >= :since")
    List<String> findDistinctSuccessfulIps(@Param("identifier") String identifier, @Param("since") Instant since);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE LoginAttempt a SET a.blocked = false WHERE a.identifier = :identifier " +
            "AND a.blocked = true AND a.blockedUntil > :now")
    int unblockActiveForIdentifier(@Param("identifier") String identifier, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE LoginAttempt a SET a.blocked = false WHERE a.identifier = :identifier AND a.blocked = true")
    int unblockAllForIdentifier(@Param("identifier") String identifier);

    @Query("SELECT COUNT(a) FROM LoginAttempt a WHERE a.blocked = true AND a.blockedUntil > :now")
    long countActiveBlocks(@Param("now") Instant now);

    long countByBlockReasonIsNullAndCreatedAtGreaterThanEqual(Instant since);

    long countByBlockReasonIsNullAndSuccessFalseAndCreatedAtGreaterThanEqual(Instant since);
}
