package com.safego.backend.repository;

import com.safego.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    List<AuditEvent> findByUserIdOrderByCreatedAtDesc(String userId);

    long countByCreatedAtGreaterThanEqual(Instant since);
}
