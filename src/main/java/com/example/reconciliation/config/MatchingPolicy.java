package com.example.reconciliation.config;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.example.reconciliation.domain.CounterpartyType;

/**
 * Immutable matching configuration handed to the candidate generator and the resolver when they
 * are constructed.
 *
 * @param tolerances date window and amount tolerance per counterparty type; {@code UNKNOWN} is the
 *     fallback for types without an entry
 * @param exactAmountWeight score added when the amounts agree to the cent
 * @param exactDateWeight score added when the dates are the same day
 * @param descriptionWeight multiplied by the description token overlap (0..1)
 * @param referenceWeight score added when the record's reference code appears on the bank line
 * @param acceptanceThreshold minimum score for an automatic link
 * @param minimumMargin minimum lead of the winner over the runner-up
 * @param reversalWindowDays how far apart a line and its reversal may post
 * @param reversalKeywords upper-case tokens that mark a line as a reversal
 */
public record MatchingPolicy(
    Map<CounterpartyType, Tolerance> tolerances,
    BigDecimal exactAmountWeight,
    BigDecimal exactDateWeight,
    BigDecimal descriptionWeight,
    BigDecimal referenceWeight,
    BigDecimal acceptanceThreshold,
    BigDecimal minimumMargin,
    int reversalWindowDays,
    List<String> reversalKeywords) {

  public MatchingPolicy {
    Objects.requireNonNull(tolerances, "Tolerances cannot be null");
    if (!tolerances.containsKey(CounterpartyType.UNKNOWN)) {
      throw new IllegalArgumentException("A tolerance for UNKNOWN counterparties is required");
    }
    if (minimumMargin.signum() < 0) {
      throw new IllegalArgumentException("Minimum margin cannot be negative");
    }
    tolerances = Map.copyOf(tolerances);
    reversalKeywords =
        reversalKeywords.stream().map(k -> k.trim().toUpperCase(Locale.ROOT)).toList();
  }

  /** Date window in days either side, and amount tolerance in currency units. */
  public record Tolerance(int dateWindowDays, BigDecimal amountTolerance) {
    public Tolerance {
      if (dateWindowDays < 0) {
        throw new IllegalArgumentException("Date window cannot be negative");
      }
      Objects.requireNonNull(amountTolerance, "Amount tolerance cannot be null");
      if (amountTolerance.signum() < 0) {
        throw new IllegalArgumentException("Amount tolerance cannot be negative");
      }
    }
  }

  public Tolerance toleranceFor(CounterpartyType type) {
    Tolerance tolerance = type != null ? tolerances.get(type) : null;
    return tolerance != null ? tolerance : tolerances.get(CounterpartyType.UNKNOWN);
  }

  /** The widest date window of any counterparty type. */
  public int maxDateWindowDays() {
    return tolerances.values().stream().mapToInt(Tolerance::dateWindowDays).max().orElse(0);
  }

  /** Placeholder values, matching the shipped application.properties. */
  public static MatchingPolicy defaults() {
    Map<CounterpartyType, Tolerance> tolerances = new EnumMap<>(CounterpartyType.class);
    tolerances.put(CounterpartyType.CARD, new Tolerance(3, new BigDecimal("0.00")));
    tolerances.put(CounterpartyType.BANK_TRANSFER, new Tolerance(3, new BigDecimal("0.00")));
    tolerances.put(CounterpartyType.E_TRANSFER, new Tolerance(15, new BigDecimal("1.00")));
    tolerances.put(CounterpartyType.CHEQUE, new Tolerance(30, new BigDecimal("0.00")));
    tolerances.put(CounterpartyType.LEGACY_IMPORT, new Tolerance(30, new BigDecimal("2.00")));
    tolerances.put(CounterpartyType.UNKNOWN, new Tolerance(7, new BigDecimal("0.00")));
    return new MatchingPolicy(
        tolerances,
        new BigDecimal("0.50"),
        new BigDecimal("0.30"),
        new BigDecimal("0.20"),
        new BigDecimal("0.20"),
        new BigDecimal("0.75"),
        new BigDecimal("0.10"),
        5,
        List.of("REVERSAL", "REVERSE", "NSF", "RETURN", "CHARGEBACK", "CORRECTION"));
  }
}
