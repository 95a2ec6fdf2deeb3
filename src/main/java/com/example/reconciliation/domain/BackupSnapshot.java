package com.example.reconciliation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Point-in-time copy of a row taken immediately before an apply run mutates it. Keyed by run, table
 * and row id; the payload holds every column value as JSON so the row can be restored verbatim.
 */
@Entity
@Table(
    name = "backup_snapshot",
    indexes = {@Index(name = "idx_backup_run", columnList = "run_id")},
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_backup_run_row",
          columnNames = {"run_id", "table_name", "row_id"})
    })
public class BackupSnapshot {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "run_id", nullable = false, length = 36)
  private String runId;

  @NotNull
  @Size(max = 64)
  @Column(name = "table_name", nullable = false, length = 64)
  private String tableName;

  @NotNull
  @Column(name = "row_id", nullable = false)
  private Long rowId;

  @NotNull
  @Column(name = "payload_json", nullable = false, columnDefinition = "TEXT")
  private String payloadJson;

  @Column(name = "taken_at", nullable = false, updatable = false)
  private Instant takenAt;

  @PrePersist
  protected void onCreate() {
    if (takenAt == null) {
      takenAt = Instant.now();
    }
  }

  protected BackupSnapshot() {}

  public BackupSnapshot(String runId, String tableName, Long rowId, String payloadJson) {
    this.runId = runId;
    this.tableName = tableName;
    this.rowId = rowId;
    this.payloadJson = payloadJson;
    this.takenAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getRunId() {
    return runId;
  }

  public String getTableName() {
    return tableName;
  }

  public Long getRowId() {
    return rowId;
  }

  public String getPayloadJson() {
    return payloadJson;
  }

  public Instant getTakenAt() {
    return takenAt;
  }
}
