package com.example.reconciliation.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.reconciliation.domain.Booking;
import com.example.reconciliation.domain.FinancialRecord.RecordType;
import com.example.reconciliation.repository.BookingChargeRepository;
import com.example.reconciliation.repository.BookingRepository;
import com.example.reconciliation.repository.FinancialRecordRepository;
import com.example.reconciliation.service.exception.IncompleteBookingException;

@ExtendWith(MockitoExtension.class)
class BalanceRecalculatorTest {

  @Mock private BookingRepository bookingRepository;
  @Mock private FinancialRecordRepository recordRepository;
  @Mock private BookingChargeRepository chargeRepository;

  private BalanceRecalculator balanceRecalculator;
  private Booking booking;

  @BeforeEach
  void setUp() {
    balanceRecalculator =
        new BalanceRecalculator(bookingRepository, recordRepository, chargeRepository);
    booking = new Booking("R1001", new BigDecimal("1500.00"));
    booking.setId(1L);
  }

  @Test
  void recompute_PaymentsPresent_StoresPaidAndBalance() {
    when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));
    when(recordRepository.sumByBookingAndType(1L, RecordType.PAYMENT))
        .thenReturn(new BigDecimal("500.00"));

    BookingBalance result = balanceRecalculator.recompute(1L);

    assertEquals(new BigDecimal("500.00"), result.paid());
    assertEquals(new BigDecimal("1000.00"), result.balance());
    assertTrue(result.changed());
    assertTrue(result.invariantHolds());
    assertEquals(new BigDecimal("500.00"), booking.getPaidAmount());
    assertEquals(new BigDecimal("1000.00"), booking.getBalance());
    verify(bookingRepository).save(booking);
  }

  @Test
  void recompute_CalledTwice_SecondCallReportsNoChange() {
    when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));
    when(recordRepository.sumByBookingAndType(1L, RecordType.PAYMENT))
        .thenReturn(new BigDecimal("500.00"));

    BookingBalance first = balanceRecalculator.recompute(1L);
    BookingBalance second = balanceRecalculator.recompute(1L);

    assertTrue(first.changed());
    assertFalse(second.changed());
    assertEquals(first.balance(), second.balance());
    assertEquals(first.paid(), second.paid());
  }

  @Test
  void recompute_FractionalPayments_KeepsInvariantToTheCent() {
    booking.setTotalDue(new BigDecimal("999.99"));
    when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));
    when(recordRepository.sumByBookingAndType(1L, RecordType.PAYMENT))
        .thenReturn(new BigDecimal("333.333"));

    BookingBalance result = balanceRecalculator.recompute(1L);

    assertEquals(new BigDecimal("333.33"), result.paid());
    assertEquals(new BigDecimal("666.66"), result.balance());
    assertTrue(result.invariantHolds());
  }

  @Test
  void recompute_NoPayments_PaidIsZero() {
    when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));
    when(recordRepository.sumByBookingAndType(1L, RecordType.PAYMENT)).thenReturn(BigDecimal.ZERO);

    BookingBalance result = balanceRecalculator.recompute(1L);

    assertEquals(new BigDecimal("0.00"), result.paid());
    assertEquals(new BigDecimal("1500.00"), result.balance());
  }

  @Test
  void recompute_NullTotalDue_ThrowsIncompleteBookingWithoutSaving() {
    booking.setTotalDue(null);
    when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));

    IncompleteBookingException e =
        assertThrows(IncompleteBookingException.class, () -> balanceRecalculator.recompute(1L));

    assertEquals(1L, e.getBookingId());
    verify(bookingRepository, never()).save(any());
  }

  @Test
  void recomputeOrFlag_NullTotalDue_FlagsBookingForReview() {
    booking.setTotalDue(null);
    when(bookingRepository.findById(1L)).thenReturn(Optional.of(booking));

    Optional<BookingBalance> result = balanceRecalculator.recomputeOrFlag(1L);

    assertTrue(result.isEmpty());
    assertTrue(booking.isNeedsReview());
    assertNotNull(booking.getReviewNote());
    verify(bookingRepository).save(booking);
  }

  @Test
  void recompute_UnknownBooking_ThrowsException() {
    when(bookingRepository.findById(99L)).thenReturn(Optional.empty());

    assertThrows(IllegalArgumentException.class, () -> balanceRecalculator.recompute(99L));
  }

  @Test
  void chargeDiscrepancy_ChargesShortOfTotalDue_ReturnsDifference() {
    when(chargeRepository.sumByBookingId(1L)).thenReturn(new BigDecimal("1400.00"));

    Optional<BigDecimal> difference = balanceRecalculator.chargeDiscrepancy(booking);

    assertEquals(Optional.of(new BigDecimal("-100.00")), difference);
  }

  @Test
  void chargeDiscrepancy_ChargesMatchOrMissing_ReturnsEmpty() {
    when(chargeRepository.sumByBookingId(1L))
        .thenReturn(new BigDecimal("1500.00"))
        .thenReturn(null);

    assertTrue(balanceRecalculator.chargeDiscrepancy(booking).isEmpty());
    assertTrue(balanceRecalculator.chargeDiscrepancy(booking).isEmpty());
  }
}
