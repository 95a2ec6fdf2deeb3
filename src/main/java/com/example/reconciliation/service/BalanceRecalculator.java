package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.reconciliation.domain.Booking;
import com.example.reconciliation.domain.FinancialRecord.RecordType;
import com.example.reconciliation.repository.BookingChargeRepository;
import com.example.reconciliation.repository.BookingRepository;
import com.example.reconciliation.repository.FinancialRecordRepository;
import com.example.reconciliation.service.exception.IncompleteBookingException;

/**
 * Keeps a booking's paid amount and balance in step with the payments that reference it.
 *
 * <p>Paid is the sum of every payment pointing at the booking, whether or not that payment is
 * linked to a bank line. A booking without a total due cannot be balanced and is reported, never
 * treated as owing zero.
 */
@Service
@Transactional
public class BalanceRecalculator {

  private static final Logger log = LoggerFactory.getLogger(BalanceRecalculator.class);

  private final BookingRepository bookingRepository;
  private final FinancialRecordRepository recordRepository;
  private final BookingChargeRepository chargeRepository;

  public BalanceRecalculator(
      BookingRepository bookingRepository,
      FinancialRecordRepository recordRepository,
      BookingChargeRepository chargeRepository) {
    this.bookingRepository = bookingRepository;
    this.recordRepository = recordRepository;
    this.chargeRepository = chargeRepository;
  }

  /**
   * Recomputes and stores the booking's paid amount and balance. Idempotent: a second call with no
   * change in between stores the same values and reports no change.
   *
   * @throws IncompleteBookingException if the booking has no total due
   * @throws IllegalArgumentException if the booking does not exist
   */
  public BookingBalance recompute(Long bookingId) {
    Booking booking = findBooking(bookingId);
    BookingBalance result = calculate(booking, paymentTotal(bookingId));

    booking.applyBalance(result.paid(), result.balance());
    bookingRepository.save(booking);

    if (result.changed()) {
      log.info(
          "Booking {} recalculated: paid {} -> {}, balance {} -> {}",
          booking.getReserveNumber(),
          result.previousPaid(),
          result.paid(),
          result.previousBalance(),
          result.balance());
    }
    return result;
  }

  /**
   * Recomputes the booking, or flags it for review when its total due is missing.
   *
   * @return the new balance, or empty if the booking was flagged
   */
  public Optional<BookingBalance> recomputeOrFlag(Long bookingId) {
    try {
      return Optional.of(recompute(bookingId));
    } catch (IncompleteBookingException e) {
      Booking booking = findBooking(bookingId);
      booking.flagForReview(e.getMessage());
      bookingRepository.save(booking);
      log.warn("Booking {} flagged for review: {}", booking.getReserveNumber(), e.getMessage());
      return Optional.empty();
    }
  }

  /** Pure balance arithmetic for a booking given its payment total. */
  public BookingBalance calculate(Booking booking, BigDecimal paymentTotal) {
    if (booking.getTotalDue() == null) {
      throw new IncompleteBookingException(booking.getId(), booking.getReserveNumber());
    }
    BigDecimal totalDue = money(booking.getTotalDue());
    BigDecimal paid = money(paymentTotal);
    BigDecimal balance = totalDue.subtract(paid);
    return new BookingBalance(
        booking.getId(),
        booking.getReserveNumber(),
        totalDue,
        booking.getPaidAmount(),
        paid,
        booking.getBalance(),
        balance);
  }

  /**
   * Compares the booking's charge lines with its total due. Reported only; charges and total due
   * are both left as they are.
   *
   * @return the difference (charges minus total due) when they disagree; empty when they agree,
   *     when there are no charge lines, or when the total due is missing
   */
  @Transactional(readOnly = true)
  public Optional<BigDecimal> chargeDiscrepancy(Booking booking) {
    if (booking.getTotalDue() == null) return Optional.empty();
    BigDecimal charges = chargeRepository.sumByBookingId(booking.getId());
    if (charges == null) return Optional.empty();
    BigDecimal difference = money(charges).subtract(money(booking.getTotalDue()));
    return difference.signum() == 0 ? Optional.empty() : Optional.of(difference);
  }

  /** Sum of payments currently referencing the booking. */
  @Transactional(readOnly = true)
  public BigDecimal paymentTotal(Long bookingId) {
    BigDecimal total = recordRepository.sumByBookingAndType(bookingId, RecordType.PAYMENT);
    return total != null ? total : BigDecimal.ZERO;
  }

  /** Bookings whose last recalculation could not run. */
  @Transactional(readOnly = true)
  public List<Booking> findBookingsNeedingReview() {
    return bookingRepository.findByNeedsReviewTrue();
  }

  private Booking findBooking(Long bookingId) {
    return bookingRepository
        .findById(bookingId)
        .orElseThrow(() -> new IllegalArgumentException("Booking not found: " + bookingId));
  }

  static BigDecimal money(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP);
  }
}
