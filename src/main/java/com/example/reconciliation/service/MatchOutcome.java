package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.util.List;

import com.example.reconciliation.domain.ExternalTransaction;

/**
 * What the resolver decided for one bank line.
 *
 * <ul>
 *   <li>{@code NO_MATCH}: no candidate in tolerance
 *   <li>{@code SINGLE_MATCH}: {@code winner} can be linked with {@code confidence}
 *   <li>{@code AMBIGUOUS}: {@code candidates} need an operator, see {@code reason}
 *   <li>{@code REVERSAL_PAIR}: the line offsets another bank line and is matched to it, not to a
 *       record
 * </ul>
 */
public record MatchOutcome(
    Kind kind,
    ScoredCandidate winner,
    BigDecimal confidence,
    List<ScoredCandidate> candidates,
    String reason,
    ExternalTransaction reversalOriginal,
    ExternalTransaction reversalReversing) {

  public enum Kind {
    NO_MATCH,
    SINGLE_MATCH,
    AMBIGUOUS,
    REVERSAL_PAIR
  }

  public MatchOutcome {
    candidates = candidates != null ? List.copyOf(candidates) : List.of();
  }

  public static MatchOutcome noMatch() {
    return new MatchOutcome(Kind.NO_MATCH, null, null, List.of(), null, null, null);
  }

  public static MatchOutcome single(
      ScoredCandidate winner, BigDecimal confidence, List<ScoredCandidate> ranked) {
    return new MatchOutcome(Kind.SINGLE_MATCH, winner, confidence, ranked, null, null, null);
  }

  public static MatchOutcome ambiguous(List<ScoredCandidate> ranked, String reason) {
    return new MatchOutcome(Kind.AMBIGUOUS, null, null, ranked, reason, null, null);
  }

  public static MatchOutcome reversal(ExternalTransaction original, ExternalTransaction reversing) {
    return new MatchOutcome(
        Kind.REVERSAL_PAIR, null, BigDecimal.ONE, List.of(), null, original, reversing);
  }

  public boolean isSingleMatch() {
    return kind == Kind.SINGLE_MATCH;
  }
}
