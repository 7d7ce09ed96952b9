package com.safego.backend.repository;

import com.safego.backend.model.OwnerType;
import com.safego.backend.model.SettlementThreshold;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SettlementThresholdRepository extends JpaRepository<SettlementThreshold, Long> {

    Optional<SettlementThreshold> findByOwnerTypeAndThresholdTypeAndActiveTrue(OwnerType ownerType, String thresholdType);

    Optional<SettlementThreshold> findByOwnerTypeAndThresholdType(OwnerType ownerType, String thresholdType);

    List<SettlementThreshold> findAllByOrderByOwnerTypeAsc();
}
