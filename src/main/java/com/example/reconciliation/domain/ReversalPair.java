package com.example.reconciliation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Two bank lines that cancel each other out (a debit and its reversal, an NSF item and the
 * returned deposit). Neither side is matched to a financial record on its own, and their net is
 * never matched against anything.
 */
@Entity
@Table(
    name = "reversal_pair",
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_reversal_pair_original", columnNames = "original_transaction_id"),
      @UniqueConstraint(name = "uk_reversal_pair_reversing", columnNames = "reversing_transaction_id")
    })
public class ReversalPair {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "original_transaction_id", nullable = false)
  private Long originalTransactionId;

  @NotNull
  @Column(name = "reversing_transaction_id", nullable = false)
  private Long reversingTransactionId;

  @Column(name = "run_id", length = 36)
  private String runId;

  @Size(max = 100)
  @Column(name = "created_by", length = 100)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  protected ReversalPair() {}

  public ReversalPair(Long originalTransactionId, Long reversingTransactionId, String createdBy) {
    this.originalTransactionId = originalTransactionId;
    this.reversingTransactionId = reversingTransactionId;
    this.createdBy = createdBy;
  }

  public boolean involves(Long transactionId) {
    return originalTransactionId.equals(transactionId)
        || reversingTransactionId.equals(transactionId);
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getOriginalTransactionId() {
    return originalTransactionId;
  }

  public Long getReversingTransactionId() {
    return reversingTransactionId;
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
}
