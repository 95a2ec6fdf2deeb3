package com.example.reconciliation.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * What a reconciliation run should do.
 *
 * @param sourceAccount bank account to auto-match, null for every account
 * @param from first bank line date to auto-match
 * @param to last bank line date to auto-match
 * @param autoMatch whether unreconciled bank lines in the range are matched automatically
 * @param manualLinks operator-chosen links
 * @param unlinkTransactionIds bank lines whose live link should be removed
 * @param recalculateBookingIds bookings to recompute even if nothing else touches them
 * @param requestedBy operator asking for the run
 */
public record ReconciliationRequest(
    String sourceAccount,
    LocalDate from,
    LocalDate to,
    boolean autoMatch,
    List<ManualLink> manualLinks,
    List<Long> unlinkTransactionIds,
    List<Long> recalculateBookingIds,
    String requestedBy) {

  /**
   * An operator-chosen link. If {@code bookingId} is set the payment is assigned to that booking
   * by the link, and unlinking later takes the assignment back.
   */
  public record ManualLink(Long externalTransactionId, Long financialRecordId, Long bookingId) {
    public ManualLink {
      Objects.requireNonNull(externalTransactionId, "Transaction id cannot be null");
      Objects.requireNonNull(financialRecordId, "Financial record id cannot be null");
    }
  }

  public ReconciliationRequest {
    manualLinks = manualLinks != null ? List.copyOf(manualLinks) : List.of();
    unlinkTransactionIds =
        unlinkTransactionIds != null ? List.copyOf(unlinkTransactionIds) : List.of();
    recalculateBookingIds =
        recalculateBookingIds != null ? List.copyOf(recalculateBookingIds) : List.of();
    if (autoMatch) {
      Objects.requireNonNull(from, "From date is required for auto-matching");
      Objects.requireNonNull(to, "To date is required for auto-matching");
      if (from.isAfter(to)) {
        throw new IllegalArgumentException("From date must not be after to date");
      }
    }
  }

  /** Auto-matches one account over a date range and nothing else. */
  public static ReconciliationRequest autoMatch(
      String sourceAccount, LocalDate from, LocalDate to, String requestedBy) {
    return new ReconciliationRequest(
        sourceAccount, from, to, true, List.of(), List.of(), List.of(), requestedBy);
  }

  public static ReconciliationRequest unlink(List<Long> transactionIds, String requestedBy) {
    return new ReconciliationRequest(
        null, null, null, false, List.of(), transactionIds, List.of(), requestedBy);
  }

  public static ReconciliationRequest link(List<ManualLink> links, String requestedBy) {
    return new ReconciliationRequest(null, null, null, false, links, List.of(), List.of(), requestedBy);
  }

  public static ReconciliationRequest recalculate(List<Long> bookingIds, String requestedBy) {
    return new ReconciliationRequest(
        null, null, null, false, List.of(), List.of(), bookingIds, requestedBy);
  }
}
