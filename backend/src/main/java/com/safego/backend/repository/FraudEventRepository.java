package com.safego.backend.repository;

import com.safego.backend.model.FraudEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FraudEventRepository extends JpaRepository<FraudEvent, Long> {

    List<FraudEvent> findByUserIdOrderByCreatedAtDesc(String userId);

    long countByUserIdAndEventType(String userId, String eventType);
}
