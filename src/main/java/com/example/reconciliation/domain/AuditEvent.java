package com.example.reconciliation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Append-only record of an operation that changed reconciliation state. */
@Entity
@Table(
    name = "audit_event",
    indexes = {@Index(name = "idx_audit_entity", columnList = "entity_type, entity_id")})
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Size(max = 50)
  @Column(name = "event_type", nullable = false, length = 50)
  private String eventType;

  @Size(max = 50)
  @Column(name = "entity_type", length = 50)
  private String entityType;

  @Size(max = 64)
  @Column(name = "entity_id", length = 64)
  private String entityId;

  @Size(max = 100)
  @Column(length = 100)
  private String actor;

  @Size(max = 1000)
  @Column(length = 1000)
  private String summary;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  protected AuditEvent() {}

  public AuditEvent(
      String eventType, String entityType, String entityId, String actor, String summary) {
    this.eventType = eventType;
    this.entityType = entityType;
    this.entityId = entityId;
    this.actor = actor;
    this.summary = summary;
  }

  public Long getId() {
    return id;
  }

  public String getEventType() {
    return eventType;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getEntityId() {
    return entityId;
  }

  public String getActor() {
    return actor;
  }

  public String getSummary() {
    return summary;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
