package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.reconciliation.domain.Booking;
import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.Fingerprintable;
import com.example.reconciliation.domain.ImportBatch;
import com.example.reconciliation.domain.ImportBatch.BatchKind;
import com.example.reconciliation.domain.QuarantinedRecord;
import com.example.reconciliation.domain.TransactionLink;
import com.example.reconciliation.repository.BookingRepository;
import com.example.reconciliation.repository.ExternalTransactionRepository;
import com.example.reconciliation.repository.FinancialRecordRepository;
import com.example.reconciliation.repository.ImportBatchRepository;
import com.example.reconciliation.repository.QuarantinedRecordRepository;
import com.example.reconciliation.repository.ReversalPairRepository;
import com.example.reconciliation.service.RunError.ErrorKind;
import com.example.reconciliation.service.exception.MissingFieldException;

/**
 * Imports bank lines and financial records.
 *
 * <p>Every row goes through {@link FingerprintService}. A row whose key is already stored, or
 * already seen earlier in the same batch, is skipped as a duplicate. A row that cannot be
 * fingerprinted is quarantined for review and the rest of the batch carries on.
 */
@Service
@Transactional
public class FeedImportService {

  private static final Logger log = LoggerFactory.getLogger(FeedImportService.class);

  private final ImportBatchRepository batchRepository;
  private final ExternalTransactionRepository transactionRepository;
  private final FinancialRecordRepository recordRepository;
  private final BookingRepository bookingRepository;
  private final QuarantinedRecordRepository quarantineRepository;
  private final ReversalPairRepository reversalPairRepository;
  private final FingerprintService fingerprintService;
  private final LinkLedgerService linkLedgerService;
  private final BalanceRecalculator balanceRecalculator;
  private final AuditService auditService;

  public FeedImportService(
      ImportBatchRepository batchRepository,
      ExternalTransactionRepository transactionRepository,
      FinancialRecordRepository recordRepository,
      BookingRepository bookingRepository,
      QuarantinedRecordRepository quarantineRepository,
      ReversalPairRepository reversalPairRepository,
      FingerprintService fingerprintService,
      LinkLedgerService linkLedgerService,
      BalanceRecalculator balanceRecalculator,
      AuditService auditService) {
    this.batchRepository = batchRepository;
    this.transactionRepository = transactionRepository;
    this.recordRepository = recordRepository;
    this.bookingRepository = bookingRepository;
    this.quarantineRepository = quarantineRepository;
    this.reversalPairRepository = reversalPairRepository;
    this.fingerprintService = fingerprintService;
    this.linkLedgerService = linkLedgerService;
    this.balanceRecalculator = balanceRecalculator;
    this.auditService = auditService;
  }

  /** Counts of an import. {@code errors} names every quarantined or otherwise noted row. */
  public record ImportResult(
      ImportBatch batch, int imported, int duplicates, int quarantined, List<RunError> errors) {}

  /** What an import would do, without writing anything. */
  public record ImportPreview(int wouldImport, int duplicates, int quarantined, List<RunError> errors) {}

  /** Outcome of rolling back a batch. */
  public record RollbackResult(
      ImportBatch batch, int rowsRemoved, int linksSuperseded, List<BookingBalance> rebalanced) {}

  /**
   * Imports bank lines for one account. Lines without an account of their own take
   * {@code sourceAccount}.
   */
  public ImportResult importTransactions(
      String sourceAccount,
      String sourceFile,
      List<ExternalTransactionDraft> drafts,
      String importedBy) {
    requireText(sourceAccount, "Source account");
    ImportBatch batch =
        batchRepository.save(
            new ImportBatch(BatchKind.BANK_FEED, sourceAccount, sourceFile, importedBy));

    Set<String> seen = new HashSet<>();
    List<RunError> errors = new ArrayList<>();
    List<ExternalTransaction> newRows = new ArrayList<>();
    int duplicates = 0;
    int quarantined = 0;

    for (int i = 0; i < drafts.size(); i++) {
      ExternalTransactionDraft draft = drafts.get(i).withDefaultAccount(sourceAccount);
      Optional<FingerprintKey> key = fingerprintOrQuarantine(batch, i + 1, draft, draft.rawContent(), errors);
      if (key.isEmpty()) {
        quarantined++;
        continue;
      }
      String fingerprint = key.get().value();
      if (!seen.add(fingerprint) || transactionRepository.existsByFingerprint(fingerprint)) {
        duplicates++;
        continue;
      }

      ExternalTransaction tx =
          new ExternalTransaction(
              batch,
              draft.transactionDate(),
              draft.amount().setScale(2, RoundingMode.HALF_UP),
              draft.description().trim(),
              draft.sourceAccount().trim(),
              fingerprint);
      tx.setCounterpartyName(draft.counterpartyName());
      if (draft.counterpartyType() != null) {
        tx.setCounterpartyType(draft.counterpartyType());
      }
      newRows.add(tx);
    }

    transactionRepository.saveAll(newRows);
    batch.setImportedCount(newRows.size());
    batch.setDuplicateCount(duplicates);
    batch.setQuarantinedCount(quarantined);
    batch = batchRepository.save(batch);

    log.info(
        "Imported {} bank lines for {} from {} ({} duplicates skipped, {} quarantined)",
        newRows.size(),
        sourceAccount,
        sourceFile,
        duplicates,
        quarantined);
    auditService.logEvent(
        importedBy,
        "IMPORT",
        "ImportBatch",
        batch.getId(),
        "Imported " + newRows.size() + " bank lines from " + sourceFile);

    return new ImportResult(batch, newRows.size(), duplicates, quarantined, errors);
  }

  /** Dry run of {@link #importTransactions}. */
  @Transactional(readOnly = true)
  public ImportPreview previewTransactions(
      String sourceAccount, List<ExternalTransactionDraft> drafts) {
    Set<String> seen = new HashSet<>();
    List<RunError> errors = new ArrayList<>();
    int wouldImport = 0;
    int duplicates = 0;
    for (int i = 0; i < drafts.size(); i++) {
      ExternalTransactionDraft draft = drafts.get(i).withDefaultAccount(sourceAccount);
      try {
        String fingerprint = fingerprintService.fingerprint(draft).value();
        if (!seen.add(fingerprint) || transactionRepository.existsByFingerprint(fingerprint)) {
          duplicates++;
        } else {
          wouldImport++;
        }
      } catch (MissingFieldException e) {
        errors.add(RunError.of(ErrorKind.MISSING_FIELD, "line", i + 1, e.getMessage()));
      }
    }
    return new ImportPreview(wouldImport, duplicates, errors.size(), errors);
  }

  /**
   * Imports receipts and payments from another system. Payments naming a reserve number are
   * attached to that booking and the booking is recomputed.
   */
  public ImportResult importRecords(
      String sourceSystem, String sourceFile, List<FinancialRecordDraft> drafts, String importedBy) {
    requireText(sourceSystem, "Source system");
    ImportBatch batch =
        batchRepository.save(
            new ImportBatch(BatchKind.RECORDS, sourceSystem, sourceFile, importedBy));

    Set<String> seen = new HashSet<>();
    Set<Long> touchedBookings = new LinkedHashSet<>();
    List<RunError> errors = new ArrayList<>();
    List<FinancialRecord> newRows = new ArrayList<>();
    int duplicates = 0;
    int quarantined = 0;

    for (int i = 0; i < drafts.size(); i++) {
      FinancialRecordDraft draft = withDefaultSource(drafts.get(i), sourceSystem);
      if (draft.recordType() == null) {
        quarantine(batch, i + 1, draft.rawContent(), "Missing required fields: recordType", errors);
        quarantined++;
        continue;
      }
      Optional<FingerprintKey> key = fingerprintOrQuarantine(batch, i + 1, draft, draft.rawContent(), errors);
      if (key.isEmpty()) {
        quarantined++;
        continue;
      }
      String fingerprint = key.get().value();
      if (!seen.add(fingerprint) || recordRepository.existsByFingerprint(fingerprint)) {
        duplicates++;
        continue;
      }

      FinancialRecord record =
          new FinancialRecord(
              draft.recordType(),
              draft.amount().setScale(2, RoundingMode.HALF_UP),
              draft.recordDate(),
              draft.description().trim());
      record.setVendorName(draft.vendorName());
      record.setReferenceCode(draft.referenceCode());
      record.setSourceSystem(draft.sourceSystem().trim());
      record.setFingerprint(fingerprint);
      record.setImportBatch(batch);

      if (draft.reserveNumber() != null && !draft.reserveNumber().isBlank()) {
        Optional<Booking> booking = bookingRepository.findByReserveNumber(draft.reserveNumber().trim());
        if (booking.isPresent() && record.isPayment()) {
          record.setBooking(booking.get());
          touchedBookings.add(booking.get().getId());
        } else if (booking.isEmpty()) {
          errors.add(
              RunError.of(
                  ErrorKind.NOT_FOUND,
                  "line",
                  i + 1,
                  "Booking " + draft.reserveNumber() + " not found, record imported unassigned"));
        }
      }
      newRows.add(record);
    }

    recordRepository.saveAll(newRows);
    batch.setImportedCount(newRows.size());
    batch.setDuplicateCount(duplicates);
    batch.setQuarantinedCount(quarantined);
    batch = batchRepository.save(batch);

    for (Long bookingId : touchedBookings) {
      if (balanceRecalculator.recomputeOrFlag(bookingId).isEmpty()) {
        errors.add(
            RunError.of(
                ErrorKind.INCOMPLETE_BOOKING, "Booking", bookingId, "Total due is missing"));
      }
    }

    log.info(
        "Imported {} financial records from {} ({} duplicates skipped, {} quarantined)",
        newRows.size(),
        sourceFile,
        duplicates,
        quarantined);
    auditService.logEvent(
        importedBy,
        "IMPORT",
        "ImportBatch",
        batch.getId(),
        "Imported " + newRows.size() + " financial records from " + sourceFile);

    return new ImportResult(batch, newRows.size(), duplicates, quarantined, errors);
  }

  /**
   * Undoes a bad import. The batch's rows are deleted, their live links superseded, their
   * reversal pairings removed and the affected bookings recomputed. The batch row itself stays,
   * marked as rolled back.
   *
   * @throws IllegalStateException if the batch was already rolled back
   */
  public RollbackResult rollbackBatch(Long batchId, String operator, String reason) {
    requireText(reason, "Rollback reason");
    ImportBatch batch =
        batchRepository
            .findById(batchId)
            .orElseThrow(() -> new IllegalArgumentException("Import batch not found: " + batchId));
    if (batch.isRolledBack()) {
      throw new IllegalStateException("Import batch " + batchId + " was already rolled back");
    }

    Set<Long> affectedBookings = new LinkedHashSet<>();
    int linksSuperseded = 0;
    int rowsRemoved;

    if (batch.getKind() == BatchKind.BANK_FEED) {
      List<ExternalTransaction> rows = transactionRepository.findByImportBatch(batch);
      for (ExternalTransaction tx : rows) {
        if (linkLedgerService.findActiveLink(tx.getId()).isPresent()) {
          LinkLedgerService.UnlinkResult result = linkLedgerService.detach(tx.getId(), operator);
          linksSuperseded++;
          if (result.affectedBookingId() != null) affectedBookings.add(result.affectedBookingId());
        }
        reversalPairRepository.findByTransactionId(tx.getId()).ifPresent(reversalPairRepository::delete);
      }
      transactionRepository.deleteAll(rows);
      rowsRemoved = rows.size();
    } else {
      List<FinancialRecord> rows = recordRepository.findByImportBatch(batch);
      for (FinancialRecord record : rows) {
        // Read before detaching; a link-made assignment is released by the detach
        Long bookingId = record.getBookingId();
        Optional<TransactionLink> link = linkLedgerService.findActiveLinkForRecord(record.getId());
        if (link.isPresent()) {
          LinkLedgerService.UnlinkResult result =
              linkLedgerService.detach(link.get().getExternalTransactionId(), operator);
          linksSuperseded++;
          if (result.affectedBookingId() != null) affectedBookings.add(result.affectedBookingId());
        }
        if (bookingId != null) affectedBookings.add(bookingId);
      }
      recordRepository.deleteAll(rows);
      rowsRemoved = rows.size();
    }
    recordRepository.flush();

    quarantineRepository.findByImportBatch(batch).forEach(q -> q.resolve(operator));

    batch.markRolledBack(operator);
    batchRepository.save(batch);

    List<BookingBalance> rebalanced = new ArrayList<>();
    for (Long bookingId : affectedBookings) {
      balanceRecalculator.recomputeOrFlag(bookingId).ifPresent(rebalanced::add);
    }

    log.info(
        "Rolled back import batch {}: {} rows removed, {} links superseded, {} bookings recomputed",
        batchId,
        rowsRemoved,
        linksSuperseded,
        rebalanced.size());
    auditService.logEvent(
        operator,
        "ROLLBACK",
        "ImportBatch",
        batchId,
        "Rolled back " + rowsRemoved + " rows: " + reason);

    return new RollbackResult(batch, rowsRemoved, linksSuperseded, rebalanced);
  }

  /** Open manual-review queue, oldest first. */
  @Transactional(readOnly = true)
  public List<QuarantinedRecord> findOpenQuarantine() {
    return quarantineRepository.findByResolvedFalseOrderByCreatedAtAsc();
  }

  /** Marks a quarantined row as reviewed. The row is not imported by this. */
  public QuarantinedRecord resolveQuarantined(Long quarantinedId, String operator) {
    QuarantinedRecord record =
        quarantineRepository
            .findById(quarantinedId)
            .orElseThrow(
                () -> new IllegalArgumentException("Quarantined record not found: " + quarantinedId));
    if (record.isResolved()) {
      throw new IllegalStateException("Quarantined record " + quarantinedId + " is already resolved");
    }
    record.resolve(operator);
    record = quarantineRepository.save(record);
    auditService.logEvent(
        operator, "QUARANTINE_RESOLVED", "QuarantinedRecord", quarantinedId, record.getReason());
    return record;
  }

  private Optional<FingerprintKey> fingerprintOrQuarantine(
      ImportBatch batch, int lineNumber, Fingerprintable draft, String raw, List<RunError> errors) {
    try {
      return Optional.of(fingerprintService.fingerprint(draft));
    } catch (MissingFieldException e) {
      quarantine(batch, lineNumber, raw != null ? raw : describe(draft), e.getMessage(), errors);
      return Optional.empty();
    }
  }

  private void quarantine(
      ImportBatch batch, int lineNumber, String raw, String reason, List<RunError> errors) {
    quarantineRepository.save(new QuarantinedRecord(batch, lineNumber, raw, reason));
    errors.add(RunError.of(ErrorKind.MISSING_FIELD, "line", lineNumber, reason));
    log.warn("Quarantined line {} of batch {}: {}", lineNumber, batch.getId(), reason);
  }

  private static String describe(Fingerprintable draft) {
    BigDecimal amount = draft.getAmount();
    return draft.getTransactionDate()
        + ","
        + (amount != null ? amount.toPlainString() : "")
        + ","
        + (draft.getDescription() != null ? draft.getDescription() : "")
        + ","
        + (draft.getSourceAccount() != null ? draft.getSourceAccount() : "");
  }

  private static FinancialRecordDraft withDefaultSource(FinancialRecordDraft draft, String source) {
    if (draft.sourceSystem() != null && !draft.sourceSystem().isBlank()) return draft;
    return new FinancialRecordDraft(
        draft.recordType(),
        draft.recordDate(),
        draft.amount(),
        draft.description(),
        draft.vendorName(),
        draft.referenceCode(),
        source,
        draft.reserveNumber(),
        draft.rawContent());
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
