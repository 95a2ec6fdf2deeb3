package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

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
import com.example.reconciliation.service.ChangePlan.BalanceChange;
import com.example.reconciliation.service.ChangePlan.ProposedLink;
import com.example.reconciliation.service.ChangePlan.ProposedPair;
import com.example.reconciliation.service.ChangePlan.ProposedUnlink;
import com.example.reconciliation.service.ChangePlan.RowDiff;
import com.example.reconciliation.service.ChangePlan.TransactionOutcome;
import com.example.reconciliation.service.RunError.ErrorKind;
import com.example.reconciliation.service.exception.IncompleteBookingException;

/**
 * Works out what a reconciliation request would change without changing anything. The same plan
 * is computed again under lock when the run is applied, so this class must stay free of writes.
 */
@Service
public class ReconciliationPlanner {

  private static final Logger log = LoggerFactory.getLogger(ReconciliationPlanner.class);

  private final ExternalTransactionRepository transactionRepository;
  private final FinancialRecordRepository recordRepository;
  private final BookingRepository bookingRepository;
  private final TransactionLinkRepository linkRepository;
  private final ReversalPairRepository reversalPairRepository;
  private final CandidateGenerator candidateGenerator;
  private final MatchResolver matchResolver;
  private final BalanceRecalculator balanceRecalculator;

  public ReconciliationPlanner(
      ExternalTransactionRepository transactionRepository,
      FinancialRecordRepository recordRepository,
      BookingRepository bookingRepository,
      TransactionLinkRepository linkRepository,
      ReversalPairRepository reversalPairRepository,
      CandidateGenerator candidateGenerator,
      MatchResolver matchResolver,
      BalanceRecalculator balanceRecalculator) {
    this.transactionRepository = transactionRepository;
    this.recordRepository = recordRepository;
    this.bookingRepository = bookingRepository;
    this.linkRepository = linkRepository;
    this.reversalPairRepository = reversalPairRepository;
    this.candidateGenerator = candidateGenerator;
    this.matchResolver = matchResolver;
    this.balanceRecalculator = balanceRecalculator;
  }

  /** Working state while a plan is assembled. */
  private static final class Draft {
    final List<TransactionOutcome> outcomes = new ArrayList<>();
    final List<ProposedUnlink> unlinks = new ArrayList<>();
    final List<ProposedPair> pairs = new ArrayList<>();
    final List<ProposedLink> links = new ArrayList<>();
    final List<RunError> errors = new ArrayList<>();
    final List<RowDiff> sample = new ArrayList<>();
    final Set<Long> recompute = new TreeSet<>();
    final Map<Long, BigDecimal> paidAdjustments = new HashMap<>();
    final Set<Long> unlinkedTransactions = new HashSet<>();
    final Set<Long> unlinkedRecords = new HashSet<>();
    final Set<Long> releasedRecords = new HashSet<>();
    final Set<Long> claimedTransactions = new HashSet<>();
    final Set<Long> claimedRecords = new HashSet<>();
    final int sampleSize;

    Draft(int sampleSize) {
      this.sampleSize = sampleSize;
    }

    void adjustPaid(Long bookingId, BigDecimal delta) {
      paidAdjustments.merge(bookingId, delta, BigDecimal::add);
      recompute.add(bookingId);
    }

    void diff(String table, Long rowId, Map<String, Object> before, Map<String, Object> after) {
      if (sample.size() < sampleSize) {
        sample.add(new RowDiff(table, rowId, before, after));
      }
    }
  }

  @Transactional(readOnly = true)
  public ChangePlan plan(ReconciliationRequest request, int sampleSize) {
    Draft draft = new Draft(sampleSize);

    new LinkedHashSet<>(request.unlinkTransactionIds()).forEach(txId -> planUnlink(txId, draft));
    request.manualLinks().forEach(link -> planManualLink(link, draft));
    if (request.autoMatch()) {
      planAutoMatch(request, draft);
    }
    draft.recompute.addAll(request.recalculateBookingIds());

    List<BalanceChange> balanceChanges = new ArrayList<>();
    List<Long> flagged = new ArrayList<>();
    for (Long bookingId : draft.recompute) {
      planBalance(bookingId, draft, balanceChanges, flagged);
    }

    ChangePlan plan =
        new ChangePlan(
            draft.outcomes,
            draft.unlinks,
            draft.pairs,
            draft.links,
            new ArrayList<>(draft.recompute),
            balanceChanges,
            flagged,
            draft.errors,
            draft.sample);
    log.debug(
        "Planned {} unlinks, {} pairs, {} links, {} balance changes, {} errors",
        plan.unlinks().size(),
        plan.pairs().size(),
        plan.links().size(),
        plan.balanceChanges().size(),
        plan.errors().size());
    return plan;
  }

  private void planUnlink(Long txId, Draft draft) {
    Optional<TransactionLink> active = linkRepository.findByExternalTransactionIdAndSupersededFalse(txId);
    if (active.isEmpty()) {
      draft.errors.add(
          RunError.of(ErrorKind.NOT_LINKED, "ExternalTransaction", txId, "No active link to remove"));
      return;
    }
    TransactionLink link = active.get();
    Optional<FinancialRecord> linked = recordRepository.findById(link.getFinancialRecordId());
    Long bookingId = linked.map(FinancialRecord::getBookingId).orElse(null);
    boolean releases =
        linked.isPresent() && link.getId().equals(linked.get().getBookingAssignedByLinkId());

    if (releases) {
      FinancialRecord record = linked.get();
      if (record.isPayment()) {
        draft.adjustPaid(bookingId, record.getAmount().negate());
      }
      draft.releasedRecords.add(record.getId());
      draft.diff(
          BackupService.RECORD_TABLE,
          record.getId(),
          columns("booking_id", bookingId),
          columns("booking_id", null));
    } else if (bookingId != null) {
      draft.recompute.add(bookingId);
    }

    draft.unlinks.add(
        new ProposedUnlink(txId, link.getId(), link.getFinancialRecordId(), bookingId, releases));
    draft.unlinkedTransactions.add(txId);
    draft.unlinkedRecords.add(link.getFinancialRecordId());
    draft.diff(
        BackupService.LINK_TABLE, link.getId(), columns("superseded", false), columns("superseded", true));
  }

  private void planManualLink(ReconciliationRequest.ManualLink request, Draft draft) {
    Long txId = request.externalTransactionId();
    Long recordId = request.financialRecordId();

    Optional<ExternalTransaction> tx = transactionRepository.findById(txId);
    if (tx.isEmpty()) {
      draft.errors.add(RunError.of(ErrorKind.NOT_FOUND, "ExternalTransaction", txId, "Not found"));
      return;
    }
    Optional<FinancialRecord> found = recordRepository.findById(recordId);
    if (found.isEmpty()) {
      draft.errors.add(RunError.of(ErrorKind.NOT_FOUND, "FinancialRecord", recordId, "Not found"));
      return;
    }
    FinancialRecord record = found.get();

    if (draft.claimedTransactions.contains(txId)) {
      draft.errors.add(
          RunError.of(
              ErrorKind.AMBIGUOUS_LINK_CONFLICT,
              "ExternalTransaction",
              txId,
              "Requested more than once in the same run"));
      return;
    }
    if (!draft.unlinkedTransactions.contains(txId)) {
      Optional<TransactionLink> existing =
          linkRepository.findByExternalTransactionIdAndSupersededFalse(txId);
      if (existing.isPresent()) {
        if (!existing.get().getFinancialRecordId().equals(recordId)) {
          draft.errors.add(
              RunError.of(
                  ErrorKind.AMBIGUOUS_LINK_CONFLICT,
                  "ExternalTransaction",
                  txId,
                  "Already linked to record "
                      + existing.get().getFinancialRecordId()
                      + ", requested record "
                      + recordId));
        }
        // Same pair already linked: nothing to do
        return;
      }
    }
    if (draft.claimedRecords.contains(recordId)
        || (!draft.unlinkedRecords.contains(recordId)
            && linkRepository.findByFinancialRecordIdAndSupersededFalse(recordId).isPresent())) {
      draft.errors.add(
          RunError.of(
              ErrorKind.LINK_CONFLICT,
              "FinancialRecord",
              recordId,
              "Already linked to another transaction"));
      return;
    }
    if (reversalPairRepository.findByTransactionId(txId).isPresent()) {
      draft.errors.add(
          RunError.of(
              ErrorKind.LINK_CONFLICT, "ExternalTransaction", txId, "Part of a reversal pair"));
      return;
    }

    Long assignBookingId = null;
    Long currentBooking = draft.releasedRecords.contains(recordId) ? null : record.getBookingId();
    if (request.bookingId() != null) {
      Optional<Booking> target = bookingRepository.findById(request.bookingId());
      if (target.isEmpty()) {
        draft.errors.add(
            RunError.of(ErrorKind.NOT_FOUND, "Booking", request.bookingId(), "Not found"));
        return;
      }
      if (target.get().isCancelled()) {
        draft.errors.add(
            RunError.of(
                ErrorKind.LINK_CONFLICT,
                "Booking",
                request.bookingId(),
                "Booking " + target.get().getReserveNumber() + " is cancelled"));
        return;
      }
      if (!record.isPayment()) {
        draft.errors.add(
            RunError.of(
                ErrorKind.LINK_CONFLICT,
                "FinancialRecord",
                recordId,
                "Only payments can be assigned to a booking"));
        return;
      }
      if (currentBooking != null && !currentBooking.equals(request.bookingId())) {
        draft.errors.add(
            RunError.of(
                ErrorKind.LINK_CONFLICT,
                "FinancialRecord",
                recordId,
                "Already belongs to booking " + currentBooking));
        return;
      }
      if (currentBooking == null) {
        assignBookingId = request.bookingId();
        draft.adjustPaid(assignBookingId, record.getAmount());
        draft.diff(
            BackupService.RECORD_TABLE,
            recordId,
            columns("booking_id", null),
            columns("booking_id", assignBookingId));
      }
    }
    if (currentBooking != null) {
      draft.recompute.add(currentBooking);
    }

    draft.links.add(new ProposedLink(txId, recordId, MatchType.MANUAL, BigDecimal.ONE, assignBookingId));
    draft.claimedTransactions.add(txId);
    draft.claimedRecords.add(recordId);
    draft.outcomes.add(
        new TransactionOutcome(
            txId, MatchOutcome.Kind.SINGLE_MATCH, recordId, BigDecimal.ONE, List.of(recordId), "Manual link"));
    draft.diff(BackupService.LINK_TABLE, null, Map.of(), linkColumns(txId, recordId, MatchType.MANUAL));
  }

  private void planAutoMatch(ReconciliationRequest request, Draft draft) {
    List<ExternalTransaction> open =
        transactionRepository
            .findUnreconciled(request.sourceAccount(), request.from(), request.to())
            .stream()
            .filter(t -> !draft.claimedTransactions.contains(t.getId()))
            .toList();
    CandidateGenerator.DateRange window =
        candidateGenerator.searchWindow(request.from(), request.to());
    List<FinancialRecord> pool = recordRepository.findUnlinkedByDateRange(window.from(), window.to());

    Set<Long> paired = new HashSet<>();
    for (ExternalTransaction tx : open) {
      if (paired.contains(tx.getId())) continue;
      List<ExternalTransaction> peers = open.stream().filter(p -> !paired.contains(p.getId())).toList();
      Optional<MatchOutcome> reversal = matchResolver.detectReversal(tx, peers);
      if (reversal.isPresent()) {
        ExternalTransaction original = reversal.get().reversalOriginal();
        ExternalTransaction reversing = reversal.get().reversalReversing();
        paired.add(original.getId());
        paired.add(reversing.getId());
        draft.pairs.add(new ProposedPair(original.getId(), reversing.getId()));
        draft.diff(
            "reversal_pair",
            null,
            Map.of(),
            columns("original_transaction_id", original.getId(), "reversing_transaction_id", reversing.getId()));
      }
    }

    for (ExternalTransaction tx : open) {
      if (paired.contains(tx.getId())) {
        draft.outcomes.add(
            new TransactionOutcome(
                tx.getId(), MatchOutcome.Kind.REVERSAL_PAIR, null, BigDecimal.ONE, List.of(), "Offset by reversal"));
        continue;
      }
      List<FinancialRecord> candidates =
          candidateGenerator
              .candidates(tx, pool)
              .filter(r -> !draft.claimedRecords.contains(r.getId()))
              .toList();
      MatchOutcome outcome = matchResolver.resolve(tx, candidates);
      List<Long> candidateIds = outcome.candidates().stream().map(ScoredCandidate::recordId).toList();

      if (outcome.isSingleMatch()) {
        FinancialRecord record = outcome.winner().record();
        draft.links.add(
            new ProposedLink(
                tx.getId(), record.getId(), outcome.winner().matchType(), outcome.confidence(), null));
        draft.claimedTransactions.add(tx.getId());
        draft.claimedRecords.add(record.getId());
        if (record.getBookingId() != null) {
          draft.recompute.add(record.getBookingId());
        }
        draft.outcomes.add(
            new TransactionOutcome(
                tx.getId(), outcome.kind(), record.getId(), outcome.confidence(), candidateIds, null));
        draft.diff(
            BackupService.LINK_TABLE,
            null,
            Map.of(),
            linkColumns(tx.getId(), record.getId(), outcome.winner().matchType()));
      } else {
        draft.outcomes.add(
            new TransactionOutcome(tx.getId(), outcome.kind(), null, null, candidateIds, outcome.reason()));
      }
    }
  }

  private void planBalance(
      Long bookingId, Draft draft, List<BalanceChange> balanceChanges, List<Long> flagged) {
    Optional<Booking> found = bookingRepository.findById(bookingId);
    if (found.isEmpty()) {
      draft.errors.add(RunError.of(ErrorKind.NOT_FOUND, "Booking", bookingId, "Not found"));
      return;
    }
    Booking booking = found.get();
    try {
      BigDecimal paid =
          balanceRecalculator
              .paymentTotal(bookingId)
              .add(draft.paidAdjustments.getOrDefault(bookingId, BigDecimal.ZERO));
      BookingBalance balance = balanceRecalculator.calculate(booking, paid);
      if (balance.changed()) {
        balanceChanges.add(BalanceChange.of(balance));
        draft.diff(
            BackupService.BOOKING_TABLE,
            bookingId,
            columns("paid_amount", balance.previousPaid(), "balance", balance.previousBalance()),
            columns("paid_amount", balance.paid(), "balance", balance.balance()));
      }
    } catch (IncompleteBookingException e) {
      log.warn("Booking {} cannot be recalculated: {}", booking.getReserveNumber(), e.getMessage());
      flagged.add(bookingId);
      draft.errors.add(
          RunError.of(ErrorKind.INCOMPLETE_BOOKING, "Booking", bookingId, e.getMessage()));
      return;
    }
    balanceRecalculator
        .chargeDiscrepancy(booking)
        .ifPresent(
            difference -> {
              log.warn(
                  "Booking {} charges differ from total due by {}",
                  booking.getReserveNumber(),
                  difference);
              draft.errors.add(
                  RunError.of(
                      ErrorKind.CHARGE_MISMATCH,
                      "Booking",
                      bookingId,
                      "Charges differ from total due by " + difference));
            });
  }

  private static Map<String, Object> linkColumns(Long txId, Long recordId, MatchType matchType) {
    return columns(
        "external_transaction_id", txId, "financial_record_id", recordId, "match_type", matchType);
  }

  // Values may be null; keeps column order
  private static Map<String, Object> columns(Object... keysAndValues) {
    Map<String, Object> columns = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      columns.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return columns;
  }
}
