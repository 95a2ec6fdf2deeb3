package com.example.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.AuditEvent;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

  List<AuditEvent> findByEntityTypeAndEntityIdOrderByCreatedAtDesc(
      String entityType, String entityId);
}
