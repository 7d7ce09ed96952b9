package com.safego.backend.repository;

import com.safego.backend.model.DriverNegativeBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface DriverNegativeBalanceRepository extends JpaRepository<DriverNegativeBalance, Long> {

    Optional<DriverNegativeBalance> findByDriverId(String driverId);

    List<DriverNegativeBalance> findByRestrictedTrueOrderByRestrictedAtDesc();

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverNegativeBalance b SET b.currentBalance = b.currentBalance + :commission, " +
            "b.totalCommissionDue = b.totalCommissionDue + :commission, " +
            "b.totalCashCollected = b.totalCashCollected + :cashAmount, " +
            "b.totalCashTrips = b.totalCashTrips + 1, b.lastUpdated = :now WHERE b.driverId = :driverId")
    int accrue(@Param("driverId") String driverId, @Param("commission") BigDecimal commission,
               @Param("cashAmount") BigDecimal cashAmount, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverNegativeBalance b SET b.currentBalance = b.currentBalance - :amount, " +
            "b.totalOnlineSettled = b.totalOnlineSettled + :amount, b.lastUpdated = :now WHERE b.driverId = :driverId")
    int credit(@Param("driverId") String driverId, @Param("amount") BigDecimal amount, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverNegativeBalance b SET b.currentBalance = b.currentBalance + :delta, b.lastUpdated = :now " +
            "WHERE b.driverId = :driverId")
    int adjust(@Param("driverId") String driverId, @Param("delta") BigDecimal delta, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverNegativeBalance b SET b.restricted = true, b.restrictedAt = :now, b.restrictionReason = :reason " +
            "WHERE b.driverId = :driverId AND b.restricted = false")
    int markRestricted(@Param("driverId") String driverId, @Param("now") Instant now, @Param("reason") String reason);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverNegativeBalance b SET b.restricted = false, b.restrictedAt = null, b.restrictionReason = null, " +
            "b.lastUpdated = :now WHERE b.driverId = :driverId")
    int clearRestriction(@Param("driverId") String driverId, @Param("now") Instant now);
}
