package com.safego.backend.repository;

import com.safego.backend.model.SecurityAlert;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SecurityAlertRepository extends JpaRepository<SecurityAlert, Long> {

    List<SecurityAlert> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    List<SecurityAlert> findByUserIdAndAcknowledgedOrderByCreatedAtDesc(String userId, boolean acknowledged, Pageable pageable);

    List<SecurityAlert> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<SecurityAlert> findByAcknowledgedOrderByCreatedAtDesc(boolean acknowledged, Pageable pageable);

    long countByCreatedAtGreaterThanEqual(Instant since);

    long countByAcknowledgedFalse();
}
