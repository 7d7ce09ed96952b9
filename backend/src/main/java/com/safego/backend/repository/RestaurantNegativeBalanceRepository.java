package com.safego.backend.repository;

import com.safego.backend.model.RestaurantNegativeBalance;
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
public interface RestaurantNegativeBalanceRepository extends JpaRepository<RestaurantNegativeBalance, Long> {

    Optional<RestaurantNegativeBalance> findByRestaurantId(String restaurantId);

    List<RestaurantNegativeBalance> findByRestrictedTrueOrderByRestrictedAtDesc();

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RestaurantNegativeBalance b SET b.currentBalance = b.currentBalance + :commission, " +
            "b.totalCommissionDue = b.totalCommissionDue + :commission, " +
            "b.totalCashCollected = b.totalCashCollected + :cashAmount, " +
            "b.totalCashOrders = b.totalCashOrders + 1, b.lastUpdated = :now WHERE b.restaurantId = :restaurantId")
    int accrue(@Param("restaurantId") String restaurantId, @Param("commission") BigDecimal commission,
               @Param("cashAmount") BigDecimal cashAmount, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RestaurantNegativeBalance b SET b.currentBalance = b.currentBalance - :amount, " +
            "b.totalOnlineSettled = b.totalOnlineSettled + :amount, b.lastUpdated = :now WHERE b.restaurantId = :restaurantId")
    int credit(@Param("restaurantId") String restaurantId, @Param("amount") BigDecimal amount, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RestaurantNegativeBalance b SET b.currentBalance = b.currentBalance + :delta, b.lastUpdated = :now " +
            "WHERE b.restaurantId = :restaurantId")
    int adjust(@Param("restaurantId") String restaurantId, @Param("delta") BigDecimal delta, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RestaurantNegativeBalance b SET b.restricted = true, b.restrictedAt = :now, b.restrictionReason = :reason " +
            "WHERE b.restaurantId = :restaurantId AND b.restricted = false")
    int markRestricted(@Param("restaurantId") String restaurantId, @Param("now") Instant now, @Param("reason") String reason);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RestaurantNegativeBalance b SET b.restricted = false, b.restrictedAt = null, b.restrictionReason = null, " +
            "b.lastUpdated = :now WHERE b.restaurantId = :restaurantId")
    int clearRestriction(@Param("restaurantId") String restaurantId, @Param("now") Instant now);
}
