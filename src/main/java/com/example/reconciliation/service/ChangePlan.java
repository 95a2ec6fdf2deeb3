package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.example.reconciliation.domain.TransactionLink.MatchType;

/**
 * Everything a reconciliation run would change, in the order it would change it: unlinks, then
 * reversal pairs, then links, then booking balances.
 */
public record ChangePlan(
    List<TransactionOutcome> outcomes,
    List<ProposedUnlink> unlinks,
    List<ProposedPair> pairs,
    List<ProposedLink> links,
    List<Long> bookingsToRecompute,
    List<BalanceChange> balanceChanges,
    List<Long> flaggedBookingIds,
    List<RunError> errors,
    List<RowDiff> sample) {

  public ChangePlan {
    outcomes = List.copyOf(outcomes);
    unlinks = List.copyOf(unlinks);
    pairs = List.copyOf(pairs);
    links = List.copyOf(links);
    bookingsToRecompute = List.copyOf(bookingsToRecompute);
    balanceChanges = List.copyOf(balanceChanges);
    flaggedBookingIds = List.copyOf(flaggedBookingIds);
    errors = List.copyOf(errors);
    sample = List.copyOf(sample);
  }

  public record ProposedUnlink(
      Long externalTransactionId,
      Long linkId,
      Long financialRecordId,
      Long affectedBookingId,
      boolean releasesBooking) {}

  public record ProposedPair(Long originalTransactionId, Long reversingTransactionId) {}

  public record ProposedLink(
      Long externalTransactionId,
      Long financialRecordId,
      MatchType matchType,
      BigDecimal confidence,
      Long assignBookingId) {}

  public record BalanceChange(
      Long bookingId,
      String reserveNumber,
      BigDecimal oldPaid,
      BigDecimal newPaid,
      BigDecimal oldBalance,
      BigDecimal newBalance) {

    static BalanceChange of(BookingBalance balance) {
      return new BalanceChange(
          balance.bookingId(),
          balance.reserveNumber(),
          balance.previousPaid(),
          balance.paid(),
          balance.previousBalance(),
          balance.balance());
    }
  }

  /** The result for one bank line. {@code financialRecordId} is set for single matches only. */
  public record TransactionOutcome(
      Long externalTransactionId,
      MatchOutcome.Kind kind,
      Long financialRecordId,
      BigDecimal confidence,
      List<Long> candidateRecordIds,
      String reason) {}

  /** A literal before and after of the columns a change touches. {@code before} empty on insert. */
  public record RowDiff(
      String table, Long rowId, Map<String, Object> before, Map<String, Object> after) {}

  /** Identifiers of the bank lines this plan writes to. */
  public Set<Long> touchedTransactionIds() {
    Set<Long> ids = new HashSet<>();
    unlinks.forEach(u -> ids.add(u.externalTransactionId()));
    pairs.forEach(
        p -> {
          ids.add(p.originalTransactionId());
          ids.add(p.reversingTransactionId());
        });
    links.forEach(l -> ids.add(l.externalTransactionId()));
    return ids;
  }

  /** Identifiers of the financial records this plan writes to or links. */
  public Set<Long> touchedRecordIds() {
    Set<Long> ids = new HashSet<>();
    unlinks.forEach(u -> ids.add(u.financialRecordId()));
    links.forEach(l -> ids.add(l.financialRecordId()));
    return ids;
  }

  /** True if both plans would make the same writes. Samples and outcomes are not compared. */
  public boolean sameChanges(ChangePlan other) {
    return unlinks.equals(other.unlinks)
        && pairs.equals(other.pairs)
        && links.equals(other.links)
        && bookingsToRecompute.equals(other.bookingsToRecompute)
        && balanceChanges.equals(other.balanceChanges);
  }

  public int errorCount() {
    return (int) errors.stream().filter(e -> !e.isWarning()).count();
  }
}
