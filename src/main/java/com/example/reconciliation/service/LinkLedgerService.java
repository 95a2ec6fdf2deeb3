package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.reconciliation.domain.Booking;
import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.TransactionLink;
import com.example.reconciliation.domain.TransactionLink.MatchType;
import com.example.reconciliation.repository.BookingRepository;
import com.example.reconciliation.repository.ExternalTransactionRepository;
import com.example.reconciliation.repository.FinancialRecordRepository;
import com.example.reconciliation.repository.ReversalPairRepository;
import com.example.reconciliation.repository.TransactionLinkRepository;
import com.example.reconciliation.service.exception.AmbiguousLinkConflictException;
import com.example.reconciliation.service.exception.LinkConflictException;

/**
 * Store of bank line to financial record links.
 *
 * <p>A bank line has at most one live link and a financial record belongs to at most one live
 * link. Unlinking supersedes the link row rather than deleting it, so the full history of a bank
 * line stays queryable. The database backs both rules with unique constraints on the active keys.
 */
@Service
@Transactional
public class LinkLedgerService {

  private static final Logger log = LoggerFactory.getLogger(LinkLedgerService.class);

  private final TransactionLinkRepository linkRepository;
  private final ExternalTransactionRepository transactionRepository;
  private final FinancialRecordRepository recordRepository;
  private final BookingRepository bookingRepository;
  private final ReversalPairRepository reversalPairRepository;
  private final BalanceRecalculator balanceRecalculator;

  public LinkLedgerService(
      TransactionLinkRepository linkRepository,
      ExternalTransactionRepository transactionRepository,
      FinancialRecordRepository recordRepository,
      BookingRepository bookingRepository,
      ReversalPairRepository reversalPairRepository,
      BalanceRecalculator balanceRecalculator) {
    this.linkRepository = linkRepository;
    this.transactionRepository = transactionRepository;
    this.recordRepository = recordRepository;
    this.bookingRepository = bookingRepository;
    this.reversalPairRepository = reversalPairRepository;
    this.balanceRecalculator = balanceRecalculator;
  }

  /** Records the result of an unlink. {@code balance} is null if no booking was recomputed. */
  public record UnlinkResult(TransactionLink link, Long affectedBookingId, BookingBalance balance) {}

  public TransactionLink link(
      Long externalTransactionId,
      Long financialRecordId,
      MatchType matchType,
      BigDecimal confidence,
      String createdBy) {
    return link(
        LinkRequest.of(externalTransactionId, financialRecordId, matchType, confidence, createdBy));
  }

  /**
   * Links a bank line to a financial record. Linking the same pair again returns the existing
   * link unchanged.
   *
   * @throws AmbiguousLinkConflictException if the bank line is already linked to another record
   * @throws LinkConflictException if the record is already linked to another bank line
   */
  public TransactionLink link(LinkRequest request) {
    Long txId = request.externalTransactionId();
    Long recordId = request.financialRecordId();

    Optional<TransactionLink> existing =
        linkRepository.findByExternalTransactionIdAndSupersededFalse(txId);
    if (existing.isPresent()) {
      TransactionLink current = existing.get();
      if (current.getFinancialRecordId().equals(recordId)) {
        log.debug("Transaction {} already linked to record {}, nothing to do", txId, recordId);
        return current;
      }
      throw new AmbiguousLinkConflictException(
          txId, current.getId(), current.getFinancialRecordId(), recordId);
    }

    Optional<TransactionLink> recordLink =
        linkRepository.findByFinancialRecordIdAndSupersededFalse(recordId);
    if (recordLink.isPresent()) {
      throw new LinkConflictException(
          "Financial record "
              + recordId
              + " is already linked to transaction "
              + recordLink.get().getExternalTransactionId(),
          txId,
          recordLink.get().getId());
    }

    ExternalTransaction tx =
        transactionRepository
            .findById(txId)
            .orElseThrow(() -> new IllegalArgumentException("Transaction not found: " + txId));
    FinancialRecord record =
        recordRepository
            .findById(recordId)
            .orElseThrow(() -> new IllegalArgumentException("Financial record not found: " + recordId));

    if (reversalPairRepository.findByTransactionId(tx.getId()).isPresent()) {
      throw new IllegalStateException(
          "Transaction " + txId + " is part of a reversal pair and cannot be linked");
    }

    Booking booking = null;
    if (request.assignBookingId() != null) {
      booking =
          bookingRepository
              .findById(request.assignBookingId())
              .orElseThrow(
                  () ->
                      new IllegalArgumentException(
                          "Booking not found: " + request.assignBookingId()));
      if (booking.isCancelled()) {
        throw new IllegalStateException(
            "Booking " + booking.getReserveNumber() + " is cancelled and takes no new payments");
      }
      Long currentBooking = record.getBookingId();
      if (currentBooking != null && !currentBooking.equals(booking.getId())) {
        throw new IllegalStateException(
            "Financial record " + recordId + " already belongs to booking " + currentBooking);
      }
      if (!record.isPayment()) {
        throw new IllegalArgumentException("Only payments can be assigned to a booking");
      }
    }

    TransactionLink link =
        new TransactionLink(
            txId, recordId, request.matchType(), request.confidence(), request.createdBy());
    link.setRunId(request.runId());
    link = linkRepository.save(link);

    // An already-correct booking reference belongs to the record, not to this link
    if (booking != null && record.getBookingId() == null) {
      record.assignBookingByLink(booking, link.getId());
      recordRepository.save(record);
      link.setAssignedBookingId(booking.getId());
      link = linkRepository.save(link);
    }

    log.info(
        "Linked transaction {} to record {} ({}, confidence {})",
        txId,
        recordId,
        request.matchType(),
        request.confidence());
    return link;
  }

  /**
   * Supersedes the live link of a bank line and reverts any booking assignment the link made.
   * Balances are left alone; callers recompute the affected booking.
   *
   * @throws IllegalArgumentException if the bank line has no live link
   */
  public UnlinkResult detach(Long externalTransactionId, String actor) {
    TransactionLink link =
        linkRepository
            .findByExternalTransactionIdAndSupersededFalse(externalTransactionId)
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "No active link for transaction " + externalTransactionId));

    link.supersede(actor);
    linkRepository.save(link);

    Long affectedBookingId = null;
    Optional<FinancialRecord> record = recordRepository.findById(link.getFinancialRecordId());
    if (record.isPresent()) {
      FinancialRecord linked = record.get();
      affectedBookingId = linked.getBookingId();
      if (linked.releaseBookingAssignedBy(link.getId())) {
        recordRepository.save(linked);
      }
    } else {
      log.warn(
          "Link {} points at missing financial record {}", link.getId(), link.getFinancialRecordId());
    }

    log.info(
        "Unlinked transaction {} from record {} by {}",
        externalTransactionId,
        link.getFinancialRecordId(),
        actor);
    return new UnlinkResult(link, affectedBookingId, null);
  }

  /**
   * Removes the live link of a bank line and recomputes the booking the linked payment belonged
   * to. A booking without a total due is flagged for review instead.
   */
  public UnlinkResult unlink(Long externalTransactionId, String actor) {
    UnlinkResult detached = detach(externalTransactionId, actor);
    if (detached.affectedBookingId() == null) {
      return detached;
    }
    BookingBalance balance =
        balanceRecalculator.recomputeOrFlag(detached.affectedBookingId()).orElse(null);
    return new UnlinkResult(detached.link(), detached.affectedBookingId(), balance);
  }

  @Transactional(readOnly = true)
  public Optional<TransactionLink> findActiveLink(Long externalTransactionId) {
    return linkRepository.findByExternalTransactionIdAndSupersededFalse(externalTransactionId);
  }

  @Transactional(readOnly = true)
  public Optional<TransactionLink> findActiveLinkForRecord(Long financialRecordId) {
    return linkRepository.findByFinancialRecordIdAndSupersededFalse(financialRecordId);
  }

  /** Every link a bank line has had, newest first. */
  @Transactional(readOnly = true)
  public List<TransactionLink> findHistory(Long externalTransactionId) {
    Objects.requireNonNull(externalTransactionId, "Transaction id cannot be null");
    return linkRepository.findByExternalTransactionIdOrderByCreatedAtDesc(externalTransactionId);
  }
}
