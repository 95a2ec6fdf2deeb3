package com.example.reconciliation.service;

import java.math.BigDecimal;

/**
 * Derived amounts of a booking. The {@code previous*} values are what was stored before the
 * recalculation ({@code previousBalance} is null if the booking was never recalculated).
 */
public record BookingBalance(
    Long bookingId,
    String reserveNumber,
    BigDecimal totalDue,
    BigDecimal previousPaid,
    BigDecimal paid,
    BigDecimal previousBalance,
    BigDecimal balance) {

  /** True if the stored values differ from the derived ones. */
  public boolean changed() {
    return !sameAmount(previousPaid, paid) || !sameAmount(previousBalance, balance);
  }

  /** balance = total due - paid, to the cent. */
  public boolean invariantHolds() {
    return totalDue.subtract(paid).compareTo(balance) == 0;
  }

  private static boolean sameAmount(BigDecimal a, BigDecimal b) {
    if (a == null || b == null) return a == b;
    return a.compareTo(b) == 0;
  }
}
