package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.example.reconciliation.config.MatchingPolicy;
import com.example.reconciliation.config.MatchingPolicy.Tolerance;
import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.TransactionLink.MatchType;

/**
 * Scores a candidate record against a bank line.
 *
 * <p>The score is a weighted sum. An exact amount earns the full amount weight and an inexact one
 * within tolerance earns at most half of it, shrinking with the difference. The date works the
 * same way against the date window. Description overlap is the share of words the two sides have
 * in common. A reference code found on the bank line earns the reference weight.
 */
@Service
public class MatchScorer {

  private static final int SCALE = 4;
  private static final BigDecimal HALF = new BigDecimal("0.5");

  private final MatchingPolicy policy;

  public MatchScorer(MatchingPolicy policy) {
    this.policy = policy;
  }

  public ScoredCandidate score(ExternalTransaction tx, FinancialRecord record) {
    BigDecimal amountDelta = CandidateGenerator.amountDelta(tx, record);
    long dateDelta = CandidateGenerator.dateDelta(tx, record);
    Tolerance tolerance = policy.toleranceFor(tx.getCounterpartyType());

    if (record.getFingerprint() != null && record.getFingerprint().equals(tx.getFingerprint())) {
      return new ScoredCandidate(record, BigDecimal.ONE, amountDelta, dateDelta, MatchType.EXACT_HASH);
    }

    BigDecimal score =
        amountComponent(amountDelta, tolerance.amountTolerance())
            .add(dateComponent(dateDelta, tolerance.dateWindowDays()))
            .add(
                policy
                    .descriptionWeight()
                    .multiply(
                        tokenOverlap(
                            tokens(tx.getDescription(), tx.getCounterpartyName()),
                            tokens(record.getDescription(), record.getVendorName()))))
            .add(referenceComponent(tx, record))
            .setScale(SCALE, RoundingMode.HALF_UP);

    MatchType type =
        amountDelta.signum() == 0 && dateDelta == 0
            ? MatchType.EXACT_AMOUNT_DATE
            : MatchType.FUZZY;
    return new ScoredCandidate(record, score, amountDelta, dateDelta, type);
  }

  private BigDecimal amountComponent(BigDecimal delta, BigDecimal tolerance) {
    if (delta.signum() == 0) return policy.exactAmountWeight();
    if (tolerance.signum() == 0 || delta.compareTo(tolerance) > 0) return BigDecimal.ZERO;
    BigDecimal closeness =
        BigDecimal.ONE.subtract(delta.divide(tolerance, SCALE, RoundingMode.HALF_UP));
    return policy.exactAmountWeight().multiply(HALF).multiply(closeness);
  }

  private BigDecimal dateComponent(long delta, int window) {
    if (delta == 0) return policy.exactDateWeight();
    if (delta > window) return BigDecimal.ZERO;
    BigDecimal closeness =
        BigDecimal.ONE.subtract(
            BigDecimal.valueOf(delta)
                .divide(BigDecimal.valueOf(window + 1L), SCALE, RoundingMode.HALF_UP));
    return policy.exactDateWeight().multiply(HALF).multiply(closeness);
  }

  private BigDecimal referenceComponent(ExternalTransaction tx, FinancialRecord record) {
    String reference = record.getReferenceCode();
    if (reference == null || reference.isBlank() || tx.getDescription() == null) {
      return BigDecimal.ZERO;
    }
    String haystack = tx.getDescription().toUpperCase(Locale.ROOT);
    return haystack.contains(reference.trim().toUpperCase(Locale.ROOT))
        ? policy.referenceWeight()
        : BigDecimal.ZERO;
  }

  /** Jaccard overlap of two word sets, 0 when either is empty. */
  static BigDecimal tokenOverlap(Set<String> left, Set<String> right) {
    if (left.isEmpty() || right.isEmpty()) return BigDecimal.ZERO;
    Set<String> union = new HashSet<>(left);
    union.addAll(right);
    Set<String> common = new HashSet<>(left);
    common.retainAll(right);
    return BigDecimal.valueOf(common.size())
        .divide(BigDecimal.valueOf(union.size()), SCALE, RoundingMode.HALF_UP);
  }

  /** Upper-case words of two or more letters or digits. */
  static Set<String> tokens(String... texts) {
    return Arrays.stream(texts)
        .filter(t -> t != null && !t.isBlank())
        .flatMap(t -> Arrays.stream(t.toUpperCase(Locale.ROOT).split("[^A-Z0-9]+")))
        .filter(t -> t.length() >= 2)
        .collect(Collectors.toSet());
  }
}
