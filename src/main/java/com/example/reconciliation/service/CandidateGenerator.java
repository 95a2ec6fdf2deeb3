package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.springframework.stereotype.Service;

import com.example.reconciliation.config.MatchingPolicy;
import com.example.reconciliation.config.MatchingPolicy.Tolerance;
import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.FinancialRecord;

/**
 * Narrows a pool of financial records down to the plausible counterparts of one bank line.
 *
 * <p>A record qualifies when its bank-signed amount is within the amount tolerance and its date is
 * within the date window configured for the bank line's counterparty type. Candidates come out
 * ordered by amount difference, then date difference, then id. Nothing is written.
 */
@Service
public class CandidateGenerator {

  private final MatchingPolicy policy;

  public CandidateGenerator(MatchingPolicy policy) {
    this.policy = policy;
  }

  /** The date range a record pool must cover to hold every candidate for lines in the range. */
  public record DateRange(LocalDate from, LocalDate to) {}

  public Stream<FinancialRecord> candidates(
      ExternalTransaction tx, Iterable<FinancialRecord> pool) {
    Objects.requireNonNull(tx, "Transaction cannot be null");
    Tolerance tolerance = policy.toleranceFor(tx.getCounterpartyType());

    Comparator<FinancialRecord> order =
        Comparator.comparing((FinancialRecord r) -> amountDelta(tx, r))
            .thenComparingLong(r -> dateDelta(tx, r))
            .thenComparing(FinancialRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    return StreamSupport.stream(pool.spliterator(), false)
        .filter(r -> r.getAmount() != null && r.getRecordDate() != null)
        .filter(r -> amountDelta(tx, r).compareTo(tolerance.amountTolerance()) <= 0)
        .filter(r -> dateDelta(tx, r) <= tolerance.dateWindowDays())
        .sorted(order);
  }

  public DateRange searchWindow(LocalDate from, LocalDate to) {
    int days = policy.maxDateWindowDays();
    return new DateRange(from.minusDays(days), to.plusDays(days));
  }

  /** Absolute difference between the bank amount and the record's bank-signed amount. */
  public static BigDecimal amountDelta(ExternalTransaction tx, FinancialRecord record) {
    return tx.getAmount().subtract(record.getBankSignedAmount()).abs();
  }

  /** Absolute number of days between the bank line and the record. */
  public static long dateDelta(ExternalTransaction tx, FinancialRecord record) {
    return Math.abs(ChronoUnit.DAYS.between(tx.getTransactionDate(), record.getRecordDate()));
  }
}
