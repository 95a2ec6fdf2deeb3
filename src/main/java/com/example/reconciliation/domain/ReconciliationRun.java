package com.example.reconciliation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Record of one apply invocation. Previews are not persisted; only runs that reached the commit
 * phase leave a row behind, together with their backup snapshots.
 */
@Entity
@Table(name = "reconciliation_run")
public class ReconciliationRun {

  public enum RunStatus {
    APPLIED, // Committed
    ABORTED // Rolled back, storage unchanged apart from backups
  }

  @Id
  @Column(length = 36)
  private String id;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private RunStatus status;

  @Size(max = 100)
  @Column(name = "applied_by", length = 100)
  private String appliedBy;

  @Column(name = "links_created")
  private int linksCreated;

  @Column(name = "links_removed")
  private int linksRemoved;

  @Column(name = "reversal_pairs")
  private int reversalPairs;

  @Column(name = "balances_changed")
  private int balancesChanged;

  @Column(name = "error_count")
  private int errorCount;

  @Size(max = 1000)
  @Column(name = "failure_message", length = 1000)
  private String failureMessage;

  @Column(name = "previewed_at")
  private Instant previewedAt;

  @Column(name = "finished_at")
  private Instant finishedAt;

  protected ReconciliationRun() {}

  public ReconciliationRun(String id, RunStatus status, String appliedBy, Instant previewedAt) {
    this.id = id;
    this.status = status;
    this.appliedBy = appliedBy;
    this.previewedAt = previewedAt;
    this.finishedAt = Instant.now();
  }

  public boolean isApplied() {
    return status == RunStatus.APPLIED;
  }

  public String getId() {
    return id;
  }

  public RunStatus getStatus() {
    return status;
  }

  public String getAppliedBy() {
    return appliedBy;
  }

  public int getLinksCreated() {
    return linksCreated;
  }

  public void setLinksCreated(int linksCreated) {
    this.linksCreated = linksCreated;
  }

  public int getLinksRemoved() {
    return linksRemoved;
  }

  public void setLinksRemoved(int linksRemoved) {
    this.linksRemoved = linksRemoved;
  }

  public int getReversalPairs() {
    return reversalPairs;
  }

  public void setReversalPairs(int reversalPairs) {
    this.reversalPairs = reversalPairs;
  }

  public int getBalancesChanged() {
    return balancesChanged;
  }

  public void setBalancesChanged(int balancesChanged) {
    this.balancesChanged = balancesChanged;
  }

  public int getErrorCount() {
    return errorCount;
  }

  public void setErrorCount(int errorCount) {
    this.errorCount = errorCount;
  }

  public String getFailureMessage() {
    return failureMessage;
  }

  public void setFailureMessage(String failureMessage) {
    this.failureMessage = failureMessage;
  }

  public Instant getPreviewedAt() {
    return previewedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }
}
