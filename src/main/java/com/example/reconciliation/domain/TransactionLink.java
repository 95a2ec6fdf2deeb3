package com.example.reconciliation.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Associates one external transaction with one financial record. Both ends are held by id only:
 * removing either side orphans the link, it never cascades into the other side.
 *
 * <p>Superseded links are kept for the audit trail. The {@code active_*} key columns carry the
 * endpoint ids only while the link is live, so the unique constraints on them allow at most one
 * live link per external transaction and per financial record.
 */
@Entity
@Table(
    name = "transaction_link",
    indexes = {
      @Index(name = "idx_tx_link_transaction", columnList = "external_transaction_id"),
      @Index(name = "idx_tx_link_record", columnList = "financial_record_id")
    },
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_tx_link_active_tx", columnNames = "active_transaction_key"),
      @UniqueConstraint(name = "uk_tx_link_active_record", columnNames = "active_record_key")
    })
public class TransactionLink {

  public enum MatchType {
    EXACT_HASH, // Record carries the same content fingerprint as the bank line
    EXACT_AMOUNT_DATE, // Same amount to the cent on the same day
    FUZZY, // Within tolerance, accepted on score
    MANUAL // Chosen by an operator
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "external_transaction_id", nullable = false, updatable = false)
  private Long externalTransactionId;

  @NotNull
  @Column(name = "financial_record_id", nullable = false, updatable = false)
  private Long financialRecordId;

  @Column(name = "active_transaction_key")
  private Long activeTransactionKey;

  @Column(name = "active_record_key")
  private Long activeRecordKey;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "match_type", nullable = false, length = 20)
  private MatchType matchType;

  @NotNull
  @Column(nullable = false, precision = 5, scale = 4)
  private BigDecimal confidence;

  /** Booking this link pointed the record at, if any; undone when the link is superseded. */
  @Column(name = "assigned_booking_id")
  private Long assignedBookingId;

  @Column(name = "run_id", length = 36)
  private String runId;

  @NotNull
  @Size(max = 100)
  @Column(name = "created_by", nullable = false, length = 100)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private boolean superseded;

  @Size(max = 100)
  @Column(name = "superseded_by", length = 100)
  private String supersededBy;

  @Column(name = "superseded_at")
  private Instant supersededAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  // Constructors
  protected TransactionLink() {}

  public TransactionLink(
      Long externalTransactionId,
      Long financialRecordId,
      MatchType matchType,
      BigDecimal confidence,
      String createdBy) {
    this.externalTransactionId = externalTransactionId;
    this.financialRecordId = financialRecordId;
    this.activeTransactionKey = externalTransactionId;
    this.activeRecordKey = financialRecordId;
    this.matchType = matchType;
    this.confidence = confidence;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public boolean isActive() {
    return !superseded;
  }

  /** Retires the link, keeping the row for audit purposes. */
  public void supersede(String actor) {
    this.superseded = true;
    this.supersededBy = actor;
    this.supersededAt = Instant.now();
    this.activeTransactionKey = null;
    this.activeRecordKey = null;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getExternalTransactionId() {
    return externalTransactionId;
  }

  public Long getFinancialRecordId() {
    return financialRecordId;
  }

  public MatchType getMatchType() {
    return matchType;
  }

  public BigDecimal getConfidence() {
    return confidence;
  }

  public Long getAssignedBookingId() {
    return assignedBookingId;
  }

  public void setAssignedBookingId(Long assignedBookingId) {
    this.assignedBookingId = assignedBookingId;
  }

  public String getRunId() {
    return runId;
  }

  public void setRunId(String runId) {
    this.runId = runId;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isSuperseded() {
    return superseded;
  }

  public String getSupersededBy() {
    return supersededBy;
  }

  public Instant getSupersededAt() {
    return supersededAt;
  }
}
