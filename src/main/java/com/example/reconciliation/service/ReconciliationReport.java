package com.example.reconciliation.service;

import java.util.List;

import com.example.reconciliation.service.ChangePlan.BalanceChange;
import com.example.reconciliation.service.ChangePlan.TransactionOutcome;

/**
 * Structured result of a run for reporting and export. Link and pair ids are only filled for
 * applied runs; a preview reports the balance changes it would make.
 */
public record ReconciliationReport(
    String runId,
    Mode mode,
    List<TransactionOutcome> outcomes,
    List<Long> createdLinkIds,
    List<Long> removedLinkIds,
    List<Long> reversalPairIds,
    List<BalanceChange> balanceChanges,
    List<Long> flaggedBookingIds,
    List<RunError> errors,
    int backupRows) {

  public enum Mode {
    PREVIEW,
    APPLIED
  }

  public ReconciliationReport {
    outcomes = List.copyOf(outcomes);
    createdLinkIds = List.copyOf(createdLinkIds);
    removedLinkIds = List.copyOf(removedLinkIds);
    reversalPairIds = List.copyOf(reversalPairIds);
    balanceChanges = List.copyOf(balanceChanges);
    flaggedBookingIds = List.copyOf(flaggedBookingIds);
    errors = List.copyOf(errors);
  }

  public long count(MatchOutcome.Kind kind) {
    return outcomes.stream().filter(o -> o.kind() == kind).count();
  }
}
