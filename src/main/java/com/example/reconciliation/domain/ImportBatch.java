package com.example.reconciliation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One execution of an import job. Every external transaction and financial record imported by the
 * job points back to its batch so a bad import can be rolled back as a unit.
 */
@Entity
@Table(
    name = "import_batch",
    indexes = {@Index(name = "idx_import_batch_account", columnList = "source_account")})
public class ImportBatch {

  public enum BatchKind {
    BANK_FEED, // Bank statement lines (ExternalTransaction)
    RECORDS // Receipts or payments (FinancialRecord)
  }

  public enum BatchStatus {
    IMPORTED,
    ROLLED_BACK
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private BatchKind kind;

  @NotNull
  @Size(max = 100)
  @Column(name = "source_account", nullable = false, length = 100)
  private String sourceAccount;

  @Size(max = 255)
  @Column(name = "source_file")
  private String sourceFile;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private BatchStatus status = BatchStatus.IMPORTED;

  @Column(name = "imported_count", nullable = false)
  private int importedCount;

  @Column(name = "duplicate_count", nullable = false)
  private int duplicateCount;

  @Column(name = "quarantined_count", nullable = false)
  private int quarantinedCount;

  @Size(max = 100)
  @Column(name = "imported_by", length = 100)
  private String importedBy;

  @Column(name = "imported_at", nullable = false, updatable = false)
  private Instant importedAt;

  @Column(name = "rolled_back_at")
  private Instant rolledBackAt;

  @Size(max = 100)
  @Column(name = "rolled_back_by", length = 100)
  private String rolledBackBy;

  @PrePersist
  protected void onCreate() {
    if (importedAt == null) {
      importedAt = Instant.now();
    }
  }

  // Constructors
  public ImportBatch() {}

  public ImportBatch(BatchKind kind, String sourceAccount, String sourceFile, String importedBy) {
    this.kind = kind;
    this.sourceAccount = sourceAccount;
    this.sourceFile = sourceFile;
    this.importedBy = importedBy;
  }

  public boolean isRolledBack() {
    return status == BatchStatus.ROLLED_BACK;
  }

  /** Marks the batch as rolled back. The batch row itself is kept as the audit anchor. */
  public void markRolledBack(String operator) {
    this.status = BatchStatus.ROLLED_BACK;
    this.rolledBackBy = operator;
    this.rolledBackAt = Instant.now();
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public BatchKind getKind() {
    return kind;
  }

  public String getSourceAccount() {
    return sourceAccount;
  }

  public String getSourceFile() {
    return sourceFile;
  }

  public BatchStatus getStatus() {
    return status;
  }

  public int getImportedCount() {
    return importedCount;
  }

  public void setImportedCount(int importedCount) {
    this.importedCount = importedCount;
  }

  public int getDuplicateCount() {
    return duplicateCount;
  }

  public void setDuplicateCount(int duplicateCount) {
    this.duplicateCount = duplicateCount;
  }

  public int getQuarantinedCount() {
    return quarantinedCount;
  }

  public void setQuarantinedCount(int quarantinedCount) {
    this.quarantinedCount = quarantinedCount;
  }

  public String getImportedBy() {
    return importedBy;
  }

  public Instant getImportedAt() {
    return importedAt;
  }

  public Instant getRolledBackAt() {
    return rolledBackAt;
  }

  public String getRolledBackBy() {
    return rolledBackBy;
  }
}
