package com.example.reconciliation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Manual-review queue entry for a source record that could not be fingerprinted. The raw fields
 * are kept exactly as received so an operator can correct and re-import them.
 */
@Entity
@Table(
    name = "quarantined_record",
    indexes = {@Index(name = "idx_quarantine_open", columnList = "resolved, import_batch_id")})
public class QuarantinedRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "import_batch_id", nullable = false)
  private ImportBatch importBatch;

  /** Position of the record in the source feed, starting at 1. */
  @Column(name = "line_number")
  private Integer lineNumber;

  @Column(name = "raw_content", columnDefinition = "TEXT")
  private String rawContent;

  @NotNull
  @Size(max = 500)
  @Column(nullable = false, length = 500)
  private String reason;

  @Column(nullable = false)
  private boolean resolved;

  @Size(max = 100)
  @Column(name = "resolved_by", length = 100)
  private String resolvedBy;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public QuarantinedRecord() {}

  public QuarantinedRecord(
      ImportBatch importBatch, Integer lineNumber, String rawContent, String reason) {
    this.importBatch = importBatch;
    this.lineNumber = lineNumber;
    this.rawContent = rawContent;
    this.reason = reason;
  }

  public void resolve(String operator) {
    this.resolved = true;
    this.resolvedBy = operator;
    this.resolvedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public ImportBatch getImportBatch() {
    return importBatch;
  }

  public Integer getLineNumber() {
    return lineNumber;
  }

  public String getRawContent() {
    return rawContent;
  }

  public String getReason() {
    return reason;
  }

  public boolean isResolved() {
    return resolved;
  }

  public String getResolvedBy() {
    return resolvedBy;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
