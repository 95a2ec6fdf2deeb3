package com.example.reconciliation.service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A preview handed out by {@link ReconciliationRunService#preview}. Only a change set issued by
 * the same running service can be applied, and only once.
 */
public record ChangeSet(String token, Instant previewedAt, ReconciliationRequest request, ChangePlan plan) {

  public ChangeSet {
    Objects.requireNonNull(token, "Token cannot be null");
    Objects.requireNonNull(request, "Request cannot be null");
    Objects.requireNonNull(plan, "Plan cannot be null");
  }

  public int linksToCreate() {
    return plan.links().size();
  }

  public int linksToRemove() {
    return plan.unlinks().size();
  }

  public int reversalPairsToCreate() {
    return plan.pairs().size();
  }

  public int balancesToChange() {
    return plan.balanceChanges().size();
  }

  public boolean isEmpty() {
    return plan.links().isEmpty()
        && plan.unlinks().isEmpty()
        && plan.pairs().isEmpty()
        && plan.bookingsToRecompute().isEmpty();
  }

  public ReconciliationReport toReport() {
    return new ReconciliationReport(
        null,
        ReconciliationReport.Mode.PREVIEW,
        plan.outcomes(),
        List.of(),
        List.of(),
        List.of(),
        plan.balanceChanges(),
        plan.flaggedBookingIds(),
        plan.errors(),
        0);
  }
}
