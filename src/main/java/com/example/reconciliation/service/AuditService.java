package com.example.reconciliation.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.reconciliation.domain.AuditEvent;
import com.example.reconciliation.repository.AuditEventRepository;

/** Writes the audit trail. Events join the caller's transaction and vanish with its rollback. */
@Service
@Transactional
public class AuditService {

  private static final Logger log = LoggerFactory.getLogger(AuditService.class);

  private static final int MAX_SUMMARY_LENGTH = 1000;

  private final AuditEventRepository auditEventRepository;

  public AuditService(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
  }

  public AuditEvent logEvent(
      String actor, String eventType, String entityType, Object entityId, String summary) {
    String trimmed =
        summary != null && summary.length() > MAX_SUMMARY_LENGTH
            ? summary.substring(0, MAX_SUMMARY_LENGTH)
            : summary;
    AuditEvent event =
        new AuditEvent(
            eventType, entityType, entityId != null ? entityId.toString() : null, actor, trimmed);
    log.debug("Audit {} {}:{} by {}", eventType, entityType, entityId, actor);
    return auditEventRepository.save(event);
  }

  @Transactional(readOnly = true)
  public List<AuditEvent> findHistory(String entityType, Object entityId) {
    return auditEventRepository.findByEntityTypeAndEntityIdOrderByCreatedAtDesc(
        entityType, entityId.toString());
  }
}
