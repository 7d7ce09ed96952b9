package com.safego.backend.repository;

import com.safego.backend.model.DeviceHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface DeviceHistoryRepository extends JpaRepository<DeviceHistory, Long> {

    Optional<DeviceHistory> findByUserIdAndDeviceId(String userId, String deviceId);

    List<DeviceHistory> findByUserIdAndActiveTrueAndRemovedByUserFalseOrderByLastSeenAtDesc(String userId, Pageable pageable);

    List<DeviceHistory> findByUserIdOrderByLastSeenAtDesc(String userId);

    List<DeviceHistory> findByUserIdAndRemovedByUserFalseOrderByLastSeenAtDesc(String userId);

    long countByActiveTrueAndLastSeenAtGreaterThanEqual(Instant since);
}
