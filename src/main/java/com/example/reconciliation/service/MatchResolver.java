package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.reconciliation.config.MatchingPolicy;
import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.TransactionLink.MatchType;

/**
 * Picks at most one record for a bank line, or says why it cannot.
 *
 * <p>The resolver never guesses. A winner must reach the acceptance threshold and lead the
 * runner-up by the minimum margin; anything closer is {@code AMBIGUOUS}. Ties are ranked by
 * smaller amount difference, then earlier record date, so the candidate list reads best first.
 */
@Service
public class MatchResolver {

  private static final Logger log = LoggerFactory.getLogger(MatchResolver.class);

  static final Comparator<ScoredCandidate> RANKING =
      Comparator.comparing(ScoredCandidate::score, Comparator.reverseOrder())
          .thenComparing(ScoredCandidate::amountDelta)
          .thenComparing(c -> c.record().getRecordDate())
          .thenComparing(ScoredCandidate::recordId, Comparator.nullsLast(Comparator.naturalOrder()));

  private final MatchingPolicy policy;
  private final MatchScorer scorer;

  public MatchResolver(MatchingPolicy policy, MatchScorer scorer) {
    this.policy = policy;
    this.scorer = scorer;
  }

  public MatchOutcome resolve(ExternalTransaction tx, Collection<FinancialRecord> candidates) {
    if (candidates.isEmpty()) {
      return MatchOutcome.noMatch();
    }

    List<ScoredCandidate> ranked =
        candidates.stream().map(r -> scorer.score(tx, r)).sorted(RANKING).toList();
    if (log.isDebugEnabled()) {
      ranked.forEach(
          c -> log.debug("Transaction {} candidate {} scored {}", tx.getId(), c.recordId(), c.score()));
    }

    List<ScoredCandidate> hashMatches =
        ranked.stream().filter(c -> c.matchType() == MatchType.EXACT_HASH).toList();
    if (hashMatches.size() == 1) {
      return MatchOutcome.single(hashMatches.get(0), BigDecimal.ONE, ranked);
    }
    if (hashMatches.size() > 1) {
      return MatchOutcome.ambiguous(hashMatches, "Several records carry the same fingerprint");
    }

    ScoredCandidate top = ranked.get(0);
    if (top.score().compareTo(policy.acceptanceThreshold()) < 0) {
      return MatchOutcome.ambiguous(
          ranked, "Best score " + top.score() + " is below " + policy.acceptanceThreshold());
    }
    if (ranked.size() > 1) {
      ScoredCandidate runnerUp = ranked.get(1);
      BigDecimal lead = top.score().subtract(runnerUp.score());
      if (lead.compareTo(policy.minimumMargin()) < 0) {
        return MatchOutcome.ambiguous(
            ranked,
            "Records " + top.recordId() + " and " + runnerUp.recordId() + " score within "
                + policy.minimumMargin());
      }
    }

    BigDecimal confidence = top.score().min(BigDecimal.ONE);
    return MatchOutcome.single(top, confidence, ranked);
  }

  /**
   * Looks for the bank line that offsets {@code tx}: same account, exactly the opposite amount,
   * within the reversal window, with a reversal keyword on either side. The nearest such line
   * wins, then the lowest id.
   */
  public Optional<MatchOutcome> detectReversal(
      ExternalTransaction tx, Collection<ExternalTransaction> peers) {
    if (tx.getAmount().signum() == 0) {
      return Optional.empty();
    }
    boolean txFlagged = hasReversalKeyword(tx);

    Comparator<ExternalTransaction> nearest =
        Comparator.comparingLong((ExternalTransaction p) -> daysBetween(tx, p))
            .thenComparing(ExternalTransaction::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    return peers.stream()
        .filter(p -> p != tx && (p.getId() == null || !p.getId().equals(tx.getId())))
        .filter(p -> p.getSourceAccount().equalsIgnoreCase(tx.getSourceAccount()))
        .filter(p -> p.getAmount().compareTo(tx.getAmount().negate()) == 0)
        .filter(p -> daysBetween(tx, p) <= policy.reversalWindowDays())
        .filter(p -> txFlagged || hasReversalKeyword(p))
        .min(nearest)
        .map(p -> orderPair(tx, txFlagged, p));
  }

  private MatchOutcome orderPair(ExternalTransaction tx, boolean txFlagged, ExternalTransaction peer) {
    boolean peerFlagged = hasReversalKeyword(peer);
    if (txFlagged && !peerFlagged) return MatchOutcome.reversal(peer, tx);
    if (peerFlagged && !txFlagged) return MatchOutcome.reversal(tx, peer);
    // Both carry a keyword: the later line reverses the earlier one
    Comparator<ExternalTransaction> posting =
        Comparator.comparing(ExternalTransaction::getTransactionDate)
            .thenComparing(ExternalTransaction::getId, Comparator.nullsLast(Comparator.naturalOrder()));
    return posting.compare(tx, peer) > 0
        ? MatchOutcome.reversal(peer, tx)
        : MatchOutcome.reversal(tx, peer);
  }

  boolean hasReversalKeyword(ExternalTransaction tx) {
    if (tx.getDescription() == null) return false;
    Set<String> words =
        new HashSet<>(
            Arrays.asList(tx.getDescription().toUpperCase(Locale.ROOT).split("[^A-Z0-9]+")));
    return policy.reversalKeywords().stream().anyMatch(words::contains);
  }

  private static long daysBetween(ExternalTransaction a, ExternalTransaction b) {
    return Math.abs(ChronoUnit.DAYS.between(a.getTransactionDate(), b.getTransactionDate()));
  }
}
