package com.example.reconciliation.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.example.reconciliation.domain.Booking;
import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.FinancialRecord.RecordType;
import com.example.reconciliation.domain.ReconciliationRun;
import com.example.reconciliation.domain.ReconciliationRun.RunStatus;
import com.example.reconciliation.domain.ReversalPair;
import com.example.reconciliation.domain.TransactionLink;
import com.example.reconciliation.domain.TransactionLink.MatchType;
import com.example.reconciliation.repository.AuditEventRepository;
import com.example.reconciliation.repository.BackupSnapshotRepository;
import com.example.reconciliation.repository.BookingChargeRepository;
import com.example.reconciliation.repository.BookingRepository;
import com.example.reconciliation.repository.ExternalTransactionRepository;
import com.example.reconciliation.repository.FinancialRecordRepository;
import com.example.reconciliation.repository.ImportBatchRepository;
import com.example.reconciliation.repository.QuarantinedRecordRepository;
import com.example.reconciliation.repository.ReconciliationRunRepository;
import com.example.reconciliation.repository.ReversalPairRepository;
import com.example.reconciliation.repository.TransactionLinkRepository;
import com.example.reconciliation.service.ReconciliationRequest.ManualLink;
import com.example.reconciliation.service.exception.StalePreviewException;

/**
 * Preview and apply against a real schema on in-memory H2. Not transactional: each apply commits,
 * so rows are cleared after every test.
 */
@SpringBootTest
class ReconciliationRunIntegrationTest {

  private static final LocalDate MAY_1 = LocalDate.of(2024, 5, 1);
  private static final LocalDate MAY_31 = LocalDate.of(2024, 5, 31);

  @Autowired private ReconciliationRunService runService;
  @Autowired private FeedImportService feedImportService;
  @Autowired private LinkLedgerService linkLedgerService;
  @Autowired private BalanceRecalculator balanceRecalculator;
  @Autowired private BackupService backupService;
  @Autowired private AuditService auditService;

  @Autowired private BookingRepository bookingRepository;
  @Autowired private BookingChargeRepository chargeRepository;
  @Autowired private FinancialRecordRepository recordRepository;
  @Autowired private ExternalTransactionRepository transactionRepository;
  @Autowired private ImportBatchRepository batchRepository;
  @Autowired private TransactionLinkRepository linkRepository;
  @Autowired private ReversalPairRepository reversalPairRepository;
  @Autowired private QuarantinedRecordRepository quarantineRepository;
  @Autowired private ReconciliationRunRepository runRepository;
  @Autowired private BackupSnapshotRepository snapshotRepository;
  @Autowired private AuditEventRepository auditRepository;

  private Booking booking;

  @BeforeEach
  void setUp() {
    booking = bookingRepository.save(new Booking("R2001", new BigDecimal("1500.00")));
    balanceRecalculator.recompute(booking.getId());
  }

  @AfterEach
  void tearDown() {
    snapshotRepository.deleteAllInBatch();
    auditRepository.deleteAllInBatch();
    runRepository.deleteAllInBatch();
    linkRepository.deleteAllInBatch();
    reversalPairRepository.deleteAllInBatch();
    quarantineRepository.deleteAllInBatch();
    recordRepository.deleteAllInBatch();
    transactionRepository.deleteAllInBatch();
    chargeRepository.deleteAllInBatch();
    bookingRepository.deleteAllInBatch();
    batchRepository.deleteAllInBatch();
  }

  private ExternalTransaction importLine(String amount, String description) {
    ExternalTransactionDraft draft =
        new ExternalTransactionDraft(MAY_1, new BigDecimal(amount), description, null, null, null, null);
    FeedImportService.ImportResult result =
        feedImportService.importTransactions("1010", "may.csv", List.of(draft), "clerk");
    assertEquals(1, result.imported());
    return transactionRepository.findByImportBatch(result.batch()).get(0);
  }

  // Entered by the booking system without a recalculation, so the stored paid amount is stale
  private FinancialRecord savePayment(String amount, String description, Booking owner) {
    FinancialRecord record =
        new FinancialRecord(RecordType.PAYMENT, new BigDecimal(amount), MAY_1, description);
    record.setBooking(owner);
    return recordRepository.save(record);
  }

  private FinancialRecordDraft recordDraft(String amount, String description, String reserveNumber) {
    return new FinancialRecordDraft(
        RecordType.PAYMENT, MAY_1, new BigDecimal(amount), description, null, null, null, reserveNumber, null);
  }

  private Booking reload() {
    return bookingRepository.findById(booking.getId()).orElseThrow();
  }

  @Test
  void apply_SingleMatch_LinksAndRaisesPaidByPaymentAmount() {
    // Given
    ExternalTransaction tx = importLine("500.00", "E-TRANSFER SMITH");
    FinancialRecord payment = savePayment("500.00", "Deposit Smith", booking);

    // When
    ChangeSet preview =
        runService.preview(ReconciliationRequest.autoMatch("1010", MAY_1, MAY_31, "clerk"));

    // Then nothing is written yet
    assertEquals(1, preview.linksToCreate());
    assertEquals(1, preview.balancesToChange());
    assertTrue(linkLedgerService.findActiveLink(tx.getId()).isEmpty());
    assertEquals(0, BigDecimal.ZERO.compareTo(reload().getPaidAmount()));

    // When
    ReconciliationReport report = runService.apply(preview, "supervisor");

    // Then
    assertEquals(ReconciliationReport.Mode.APPLIED, report.mode());
    assertEquals(preview.linksToCreate(), report.createdLinkIds().size());
    assertEquals(preview.balancesToChange(), report.balanceChanges().size());
    assertEquals(1, report.count(MatchOutcome.Kind.SINGLE_MATCH));

    TransactionLink link = linkLedgerService.findActiveLink(tx.getId()).orElseThrow();
    assertEquals(payment.getId(), link.getFinancialRecordId());
    assertEquals(MatchType.EXACT_AMOUNT_DATE, link.getMatchType());
    assertEquals("auto-test", link.getCreatedBy());
    assertEquals(report.runId(), link.getRunId());

    Booking after = reload();
    assertEquals(0, new BigDecimal("500.00").compareTo(after.getPaidAmount()));
    assertEquals(0, new BigDecimal("1000.00").compareTo(after.getBalance()));

    ReconciliationRun run = runRepository.findById(report.runId()).orElseThrow();
    assertEquals(RunStatus.APPLIED, run.getStatus());
    assertEquals(1, run.getLinksCreated());
    assertFalse(backupService.findByRun(report.runId()).isEmpty());
    assertEquals(report.runId(), runService.findRecentRuns().get(0).getId());
    assertEquals(
        "APPLY", auditService.findHistory("ReconciliationRun", report.runId()).get(0).getEventType());
  }

  @Test
  void apply_ManualLinkThenUnlink_PaidReturnsToPreviousAmount() {
    // Given
    ExternalTransaction tx = importLine("350.00", "CHEQUE 4411");
    FinancialRecord payment = savePayment("350.00", "Cheque 4411", null);

    // When linked with a booking assignment
    ChangeSet linkPreview =
        runService.preview(
            ReconciliationRequest.link(
                List.of(new ManualLink(tx.getId(), payment.getId(), booking.getId())), "clerk"));
    runService.apply(linkPreview, "clerk");

    // Then
    assertEquals(0, new BigDecimal("350.00").compareTo(reload().getPaidAmount()));
    assertEquals(booking.getId(), recordRepository.findById(payment.getId()).orElseThrow().getBookingId());

    // When unlinked
    ChangeSet unlinkPreview =
        runService.preview(ReconciliationRequest.unlink(List.of(tx.getId()), "clerk"));
    ReconciliationReport report = runService.apply(unlinkPreview, "clerk");

    // Then
    assertEquals(1, report.removedLinkIds().size());
    Booking after = reload();
    assertEquals(0, BigDecimal.ZERO.compareTo(after.getPaidAmount()));
    assertEquals(0, new BigDecimal("1500.00").compareTo(after.getBalance()));
    assertNull(recordRepository.findById(payment.getId()).orElseThrow().getBookingId());
    assertTrue(linkLedgerService.findActiveLink(tx.getId()).isEmpty());
    assertEquals(2, linkLedgerService.findHistory(tx.getId()).size());
  }

  @Test
  void apply_SameChangeSetTwice_SecondIsStale() {
    // Given
    importLine("500.00", "E-TRANSFER SMITH");
    savePayment("500.00", "Deposit Smith", booking);
    ChangeSet preview =
        runService.preview(ReconciliationRequest.autoMatch("1010", MAY_1, MAY_31, "clerk"));
    runService.apply(preview, "clerk");

    // When / Then
    assertThrows(StalePreviewException.class, () -> runService.apply(preview, "clerk"));
    assertEquals(1, linkRepository.count());
  }

  @Test
  void apply_DataChangedAfterPreview_AbortsWithoutWriting() {
    // Given
    ExternalTransaction tx = importLine("500.00", "E-TRANSFER SMITH");
    savePayment("500.00", "Deposit Smith", booking);
    FinancialRecord other = savePayment("75.00", "Unrelated", null);
    ChangeSet preview =
        runService.preview(ReconciliationRequest.autoMatch("1010", MAY_1, MAY_31, "clerk"));
    linkLedgerService.link(tx.getId(), other.getId(), MatchType.MANUAL, BigDecimal.ONE, "someone");

    // When / Then
    assertThrows(StalePreviewException.class, () -> runService.apply(preview, "clerk"));
    assertEquals(1, linkRepository.count());
    assertEquals(0, BigDecimal.ZERO.compareTo(reload().getPaidAmount()));
    assertTrue(
        runRepository.findAll().stream().allMatch(run -> run.getStatus() == RunStatus.ABORTED));
  }

  @Test
  void apply_RecalculateBookingWithoutTotalDue_FlagsItForReview() {
    // Given
    Booking incomplete = bookingRepository.save(new Booking("R2002", null));

    // When
    ChangeSet preview =
        runService.preview(
            ReconciliationRequest.recalculate(List.of(incomplete.getId()), "clerk"));
    ReconciliationReport report = runService.apply(preview, "clerk");

    // Then
    assertEquals(List.of(incomplete.getId()), report.flaggedBookingIds());
    assertTrue(
        report.errors().stream()
            .anyMatch(error -> error.kind() == RunError.ErrorKind.INCOMPLETE_BOOKING));
    assertEquals(
        List.of(incomplete.getId()),
        balanceRecalculator.findBookingsNeedingReview().stream().map(Booking::getId).toList());
  }

  @Test
  void importTransactions_LineWithoutDescription_WaitsInReviewQueue() {
    // Given
    ExternalTransactionDraft blank =
        new ExternalTransactionDraft(MAY_1, new BigDecimal("42.00"), " ", null, null, null, "2024-05-01,42.00,");

    // When
    FeedImportService.ImportResult result =
        feedImportService.importTransactions("1010", "may.csv", List.of(blank), "clerk");

    // Then
    assertEquals(0, result.imported());
    assertEquals(1, result.quarantined());
    assertEquals(1, feedImportService.findOpenQuarantine().size());
    assertEquals(0, transactionRepository.count());
  }

  @Test
  void apply_LineWithItsReversal_PairsThemAndLinksNeither() {
    // Given
    ExternalTransaction deposit = importLine("250.00", "E-TRANSFER JONES");
    ExternalTransaction reversal = importLine("-250.00", "E-TRANSFER JONES REVERSAL");
    FinancialRecord payment = savePayment("250.00", "Jones deposit", null);

    // When
    ChangeSet preview =
        runService.preview(ReconciliationRequest.autoMatch("1010", MAY_1, MAY_31, "clerk"));
    ReconciliationReport report = runService.apply(preview, "clerk");

    // Then
    assertEquals(1, report.reversalPairIds().size());
    assertEquals(2, report.count(MatchOutcome.Kind.REVERSAL_PAIR));
    assertTrue(report.createdLinkIds().isEmpty());
    ReversalPair pair = reversalPairRepository.findByTransactionId(reversal.getId()).orElseThrow();
    assertEquals(deposit.getId(), pair.getOriginalTransactionId());
    assertEquals(reversal.getId(), pair.getReversingTransactionId());
    assertTrue(linkLedgerService.findActiveLink(deposit.getId()).isEmpty());
    assertTrue(linkLedgerService.findActiveLink(reversal.getId()).isEmpty());
    assertTrue(linkLedgerService.findActiveLinkForRecord(payment.getId()).isEmpty());
  }

  @Test
  void apply_TwoLinesForOnePayment_EarlierLineTakesIt() {
    // Given
    ExternalTransaction first = importLine("300.00", "DEPOSIT BRANCH 12");
    ExternalTransaction second = importLine("300.00", "DEPOSIT BRANCH 14");
    FinancialRecord payment = savePayment("300.00", "Charter payment", booking);

    // When
    ChangeSet preview =
        runService.preview(ReconciliationRequest.autoMatch("1010", MAY_1, MAY_31, "clerk"));
    ReconciliationReport report = runService.apply(preview, "clerk");

    // Then
    assertEquals(1, report.createdLinkIds().size());
    assertEquals(1, report.count(MatchOutcome.Kind.NO_MATCH));
    assertEquals(
        payment.getId(), linkLedgerService.findActiveLink(first.getId()).orElseThrow().getFinancialRecordId());
    assertTrue(linkLedgerService.findActiveLink(second.getId()).isEmpty());
    assertEquals(0, new BigDecimal("300.00").compareTo(reload().getPaidAmount()));
  }

  @Test
  void importRecords_PaymentAndRefund_RefundLowersPaid() {
    // When
    FeedImportService.ImportResult result =
        feedImportService.importRecords(
            "booking-system",
            "payments.csv",
            List.of(
                recordDraft("500.00", "Deposit Smith", "R2001"),
                recordDraft("-100.00", "Refund Smith", "R2001")),
            "clerk");

    // Then
    assertEquals(2, result.imported());
    Booking after = reload();
    assertEquals(0, new BigDecimal("400.00").compareTo(after.getPaidAmount()));
    assertEquals(0, new BigDecimal("1100.00").compareTo(after.getBalance()));
  }

  @Test
  void rollbackBatch_PaymentAssignedByManualLink_PaidReturnsToZero() {
    // Given a payment imported without a booking, then linked with an assignment
    ExternalTransaction tx = importLine("300.00", "E-TRANSFER BROWN");
    FeedImportService.ImportResult imported =
        feedImportService.importRecords(
            "booking-system", "payments.csv", List.of(recordDraft("300.00", "Brown deposit", null)), "clerk");
    FinancialRecord payment = recordRepository.findByImportBatch(imported.batch()).get(0);
    runService.apply(
        runService.preview(
            ReconciliationRequest.link(
                List.of(new ManualLink(tx.getId(), payment.getId(), booking.getId())), "clerk")),
        "clerk");
    assertEquals(0, new BigDecimal("300.00").compareTo(reload().getPaidAmount()));

    // When
    FeedImportService.RollbackResult result =
        feedImportService.rollbackBatch(imported.batch().getId(), "supervisor", "Wrong export file");

    // Then
    assertEquals(1, result.rowsRemoved());
    assertEquals(1, result.linksSuperseded());
    Booking after = reload();
    assertEquals(0, BigDecimal.ZERO.compareTo(after.getPaidAmount()));
    assertEquals(0, new BigDecimal("1500.00").compareTo(after.getBalance()));
    assertTrue(linkLedgerService.findActiveLink(tx.getId()).isEmpty());
  }
}
