package com.example.reconciliation.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.reconciliation.config.MatchingPolicy;
import com.example.reconciliation.domain.Booking;
import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.FinancialRecord.RecordType;
import com.example.reconciliation.domain.TransactionLink.MatchType;
import com.example.reconciliation.repository.BookingChargeRepository;
import com.example.reconciliation.repository.BookingRepository;
import com.example.reconciliation.repository.ExternalTransactionRepository;
import com.example.reconciliation.repository.FinancialRecordRepository;
import com.example.reconciliation.repository.ReversalPairRepository;
import com.example.reconciliation.repository.TransactionLinkRepository;
import com.example.reconciliation.service.ChangePlan.BalanceChange;
import com.example.reconciliation.service.ChangePlan.ProposedLink;
import com.example.reconciliation.service.ChangePlan.ProposedPair;
import com.example.reconciliation.service.ChangePlan.TransactionOutcome;
import com.example.reconciliation.service.RunError.ErrorKind;

@ExtendWith(MockitoExtension.class)
class ReconciliationPlannerTest {

  private static final LocalDate MAY_1 = LocalDate.of(2024, 5, 1);
  private static final LocalDate MAY_31 = LocalDate.of(2024, 5, 31);

  @Mock private ExternalTransactionRepository transactionRepository;
  @Mock private FinancialRecordRepository recordRepository;
  @Mock private BookingRepository bookingRepository;
  @Mock private TransactionLinkRepository linkRepository;
  @Mock private ReversalPairRepository reversalPairRepository;
  @Mock private BookingChargeRepository chargeRepository;

  private ReconciliationPlanner planner;
  private CandidateGenerator candidateGenerator;
  private Booking booking;

  @BeforeEach
  void setUp() {
    MatchingPolicy policy = MatchingPolicy.defaults();
    candidateGenerator = new CandidateGenerator(policy);
    planner =
        new ReconciliationPlanner(
            transactionRepository,
            recordRepository,
            bookingRepository,
            linkRepository,
            reversalPairRepository,
            candidateGenerator,
            new MatchResolver(policy, new MatchScorer(policy)),
            new BalanceRecalculator(bookingRepository, recordRepository, chargeRepository));

    booking = new Booking("R2001", new BigDecimal("1500.00"));
    booking.setId(5L);
  }

  private ExternalTransaction line(Long id, LocalDate date, String amount, String description) {
    ExternalTransaction tx =
        new ExternalTransaction(null, date, new BigDecimal(amount), description, "1010", "fp-" + id);
    tx.setId(id);
    return tx;
  }

  private FinancialRecord payment(Long id, LocalDate date, String amount) {
    FinancialRecord record =
        new FinancialRecord(RecordType.PAYMENT, new BigDecimal(amount), date, "Charter payment");
    record.setId(id);
    return record;
  }

  private void stubAutoMatch(List<ExternalTransaction> open, List<FinancialRecord> pool) {
    when(transactionRepository.findUnreconciled("1010", MAY_1, MAY_31)).thenReturn(open);
    CandidateGenerator.DateRange window = candidateGenerator.searchWindow(MAY_1, MAY_31);
    when(recordRepository.findUnlinkedByDateRange(window.from(), window.to())).thenReturn(pool);
  }

  private static TransactionOutcome outcomeFor(ChangePlan plan, Long txId) {
    return plan.outcomes().stream()
        .filter(o -> o.externalTransactionId().equals(txId))
        .findFirst()
        .orElseThrow();
  }

  @Test
  void plan_LineAndItsReversal_ProposesPairAndLinksNeither() {
    // Given a deposit, its reversal a day later, and a payment the deposit would match alone
    ExternalTransaction deposit = line(1L, LocalDate.of(2024, 5, 2), "250.00", "E-TRANSFER JONES");
    ExternalTransaction reversal =
        line(2L, LocalDate.of(2024, 5, 3), "-250.00", "E-TRANSFER JONES REVERSAL");
    stubAutoMatch(
        List.of(deposit, reversal), List.of(payment(10L, LocalDate.of(2024, 5, 2), "250.00")));

    // When
    ChangePlan plan =
        planner.plan(ReconciliationRequest.autoMatch("1010", MAY_1, MAY_31, "operator"), 10);

    // Then
    assertEquals(List.of(new ProposedPair(1L, 2L)), plan.pairs());
    assertTrue(plan.links().isEmpty());
    assertEquals(MatchOutcome.Kind.REVERSAL_PAIR, outcomeFor(plan, 1L).kind());
    assertEquals(MatchOutcome.Kind.REVERSAL_PAIR, outcomeFor(plan, 2L).kind());
    assertNull(outcomeFor(plan, 1L).financialRecordId());
    assertTrue(plan.bookingsToRecompute().isEmpty());
    assertTrue(plan.errors().isEmpty());
  }

  @Test
  void plan_TwoLinesForOneRecord_EarlierLineClaimsItAndLaterLineGetsNoOffer() {
    // Given two identical deposits and one payment that either would take on its own
    FinancialRecord record = payment(10L, MAY_1, "300.00");
    record.setBooking(booking);
    booking.applyBalance(new BigDecimal("300.00"), new BigDecimal("1200.00"));
    stubAutoMatch(
        List.of(line(1L, MAY_1, "300.00", "DEPOSIT"), line(2L, MAY_1, "300.00", "DEPOSIT")),
        List.of(record));
    when(bookingRepository.findById(5L)).thenReturn(Optional.of(booking));
    when(recordRepository.sumByBookingAndType(5L, RecordType.PAYMENT))
        .thenReturn(new BigDecimal("300.00"));

    // When
    ChangePlan plan =
        planner.plan(ReconciliationRequest.autoMatch("1010", MAY_1, MAY_31, "operator"), 10);

    // Then
    assertEquals(1, plan.links().size());
    ProposedLink link = plan.links().get(0);
    assertEquals(1L, link.externalTransactionId());
    assertEquals(10L, link.financialRecordId());
    assertEquals(MatchType.EXACT_AMOUNT_DATE, link.matchType());
    assertNull(link.assignBookingId());

    TransactionOutcome later = outcomeFor(plan, 2L);
    assertEquals(MatchOutcome.Kind.NO_MATCH, later.kind());
    assertTrue(later.candidateRecordIds().isEmpty());

    assertEquals(List.of(5L), plan.bookingsToRecompute());
    assertTrue(plan.balanceChanges().isEmpty());
  }

  @Test
  void plan_ManualLinkWithAssignment_ProjectsPaidBeforeAnythingIsWritten() {
    // Given
    booking.applyBalance(new BigDecimal("0.00"), new BigDecimal("1500.00"));
    FinancialRecord record = payment(10L, MAY_1, "300.00");
    when(transactionRepository.findById(1L)).thenReturn(Optional.of(line(1L, MAY_1, "300.00", "DEPOSIT")));
    when(recordRepository.findById(10L)).thenReturn(Optional.of(record));
    when(linkRepository.findByExternalTransactionIdAndSupersededFalse(1L)).thenReturn(Optional.empty());
    when(linkRepository.findByFinancialRecordIdAndSupersededFalse(10L)).thenReturn(Optional.empty());
    when(reversalPairRepository.findByTransactionId(1L)).thenReturn(Optional.empty());
    when(bookingRepository.findById(5L)).thenReturn(Optional.of(booking));

    // When
    ChangePlan plan =
        planner.plan(
            ReconciliationRequest.link(
                List.of(new ReconciliationRequest.ManualLink(1L, 10L, 5L)), "operator"),
            10);

    // Then
    assertEquals(
        List.of(new ProposedLink(1L, 10L, MatchType.MANUAL, BigDecimal.ONE, 5L)), plan.links());
    assertEquals(1, plan.balanceChanges().size());
    BalanceChange change = plan.balanceChanges().get(0);
    assertEquals(new BigDecimal("300.00"), change.newPaid());
    assertEquals(new BigDecimal("1200.00"), change.newBalance());
    assertNull(record.getBookingId());
    verify(recordRepository, never()).save(any());
    verify(bookingRepository, never()).save(any());
  }

  @Test
  void plan_ManualLinkToCancelledBooking_ReportsConflictAndProposesNothing() {
    // Given
    booking.setStatus(Booking.BookingStatus.CANCELLED);
    when(transactionRepository.findById(1L)).thenReturn(Optional.of(line(1L, MAY_1, "300.00", "DEPOSIT")));
    when(recordRepository.findById(10L)).thenReturn(Optional.of(payment(10L, MAY_1, "300.00")));
    when(linkRepository.findByExternalTransactionIdAndSupersededFalse(1L)).thenReturn(Optional.empty());
    when(linkRepository.findByFinancialRecordIdAndSupersededFalse(10L)).thenReturn(Optional.empty());
    when(reversalPairRepository.findByTransactionId(1L)).thenReturn(Optional.empty());
    when(bookingRepository.findById(5L)).thenReturn(Optional.of(booking));

    // When
    ChangePlan plan =
        planner.plan(
            ReconciliationRequest.link(
                List.of(new ReconciliationRequest.ManualLink(1L, 10L, 5L)), "operator"),
            10);

    // Then
    assertTrue(plan.links().isEmpty());
    assertTrue(plan.balanceChanges().isEmpty());
    assertEquals(1, plan.errors().size());
    RunError error = plan.errors().get(0);
    assertEquals(ErrorKind.LINK_CONFLICT, error.kind());
    assertEquals("5", error.entityId());
    assertTrue(error.message().contains("cancelled"));
  }
}
