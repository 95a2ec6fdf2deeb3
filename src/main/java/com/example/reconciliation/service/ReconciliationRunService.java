package com.example.reconciliation.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.reconciliation.config.ReconciliationProperties;
import com.example.reconciliation.domain.Booking;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.ReconciliationRun;
import com.example.reconciliation.domain.ReconciliationRun.RunStatus;
import com.example.reconciliation.domain.ReversalPair;
import com.example.reconciliation.domain.TransactionLink;
import com.example.reconciliation.repository.BookingRepository;
import com.example.reconciliation.repository.ExternalTransactionRepository;
import com.example.reconciliation.repository.FinancialRecordRepository;
import com.example.reconciliation.repository.ReconciliationRunRepository;
import com.example.reconciliation.repository.ReversalPairRepository;
import com.example.reconciliation.repository.TransactionLinkRepository;
import com.example.reconciliation.service.ChangePlan.BalanceChange;
import com.example.reconciliation.service.ChangePlan.ProposedLink;
import com.example.reconciliation.service.ChangePlan.ProposedPair;
import com.example.reconciliation.service.ChangePlan.ProposedUnlink;
import com.example.reconciliation.service.exception.ApplyAbortException;
import com.example.reconciliation.service.exception.StalePreviewException;

/**
 * Preview and apply gate for reconciliation runs.
 *
 * <p>{@link #preview} computes a change set without writing. {@link #apply} accepts only a change
 * set this service issued and has not applied yet. Under row locks it recomputes the plan and
 * refuses to go on if anything moved since the preview. It then backs up every row it is about to
 * change and applies the plan in a single transaction: unlinks, reversal pairs, links, then
 * balances. Any failure rolls the whole batch back.
 */
@Service
public class ReconciliationRunService {

  private static final Logger log = LoggerFactory.getLogger(ReconciliationRunService.class);

  private final ReconciliationPlanner planner;
  private final LinkLedgerService linkLedgerService;
  private final BalanceRecalculator balanceRecalculator;
  private final BackupService backupService;
  private final AuditService auditService;
  private final ExternalTransactionRepository transactionRepository;
  private final FinancialRecordRepository recordRepository;
  private final BookingRepository bookingRepository;
  private final TransactionLinkRepository linkRepository;
  private final ReversalPairRepository reversalPairRepository;
  private final ReconciliationRunRepository runRepository;
  private final ReconciliationProperties properties;
  private final Clock clock;
  private final TransactionTemplate applyTransaction;
  private final TransactionTemplate abortTransaction;

  // Entries older than the preview TTL are evicted on every preview and apply
  private final Map<String, ChangeSet> issuedPreviews = new ConcurrentHashMap<>();

  public ReconciliationRunService(
      ReconciliationPlanner planner,
      LinkLedgerService linkLedgerService,
      BalanceRecalculator balanceRecalculator,
      BackupService backupService,
      AuditService auditService,
      ExternalTransactionRepository transactionRepository,
      FinancialRecordRepository recordRepository,
      BookingRepository bookingRepository,
      TransactionLinkRepository linkRepository,
      ReversalPairRepository reversalPairRepository,
      ReconciliationRunRepository runRepository,
      ReconciliationProperties properties,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.planner = planner;
    this.linkLedgerService = linkLedgerService;
    this.balanceRecalculator = balanceRecalculator;
    this.backupService = backupService;
    this.auditService = auditService;
    this.transactionRepository = transactionRepository;
    this.recordRepository = recordRepository;
    this.bookingRepository = bookingRepository;
    this.linkRepository = linkRepository;
    this.reversalPairRepository = reversalPairRepository;
    this.runRepository = runRepository;
    this.properties = properties;
    this.clock = clock;
    this.applyTransaction = new TransactionTemplate(transactionManager);
    this.abortTransaction = new TransactionTemplate(transactionManager);
    this.abortTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /** Computes what the request would change. Nothing is written. */
  public ChangeSet preview(ReconciliationRequest request) {
    Objects.requireNonNull(request, "Request cannot be null");
    evictExpiredPreviews();
    ChangePlan plan = planner.plan(request, properties.getPreviewSampleSize());
    ChangeSet changeSet = new ChangeSet(UUID.randomUUID().toString(), Instant.now(clock), request, plan);
    issuedPreviews.put(changeSet.token(), changeSet);

    log.info(
        "Preview {}: {} links to create, {} to remove, {} reversal pairs, {} balances to change, {} errors",
        changeSet.token(),
        changeSet.linksToCreate(),
        changeSet.linksToRemove(),
        changeSet.reversalPairsToCreate(),
        changeSet.balancesToChange(),
        plan.errors().size());
    return changeSet;
  }

  /** Forgets an issued preview so it can no longer be applied. */
  public boolean discard(String token) {
    return issuedPreviews.remove(token) != null;
  }

  /**
   * Applies a previewed change set.
   *
   * @throws StalePreviewException if the change set was not issued here, was already applied or
   *     discarded, or the data changed since it was previewed
   * @throws ApplyAbortException if any write failed; nothing was committed apart from the backup
   *     and the aborted run record
   */
  public ReconciliationReport apply(ChangeSet changeSet, String operator) {
    Objects.requireNonNull(changeSet, "Change set cannot be null");
    evictExpiredPreviews();
    ChangeSet issued = issuedPreviews.remove(changeSet.token());
    if (issued == null || !issued.equals(changeSet)) {
      throw new StalePreviewException(
          "Change set " + changeSet.token() + " was not previewed by this process or was already used");
    }

    String runId = UUID.randomUUID().toString();
    try {
      ReconciliationReport report =
          applyTransaction.execute(status -> applyInTransaction(runId, issued, operator));
      log.info(
          "Run {} applied by {}: {} links created, {} removed, {} reversal pairs, {} balances changed",
          runId,
          operator,
          report.createdLinkIds().size(),
          report.removedLinkIds().size(),
          report.reversalPairIds().size(),
          report.balanceChanges().size());
      return report;
    } catch (StalePreviewException e) {
      recordAbort(runId, issued, operator, e);
      throw e;
    } catch (RuntimeException e) {
      recordAbort(runId, issued, operator, e);
      throw new ApplyAbortException(runId, "Run " + runId + " aborted: " + e.getMessage(), e);
    }
  }

  public List<ReconciliationRun> findRecentRuns() {
    return runRepository.findTop20ByOrderByFinishedAtDesc();
  }

  private void evictExpiredPreviews() {
    Instant cutoff = Instant.now(clock).minus(properties.getPreviewTtl());
    issuedPreviews
        .values()
        .removeIf(
            changeSet -> {
              boolean expired = changeSet.previewedAt().isBefore(cutoff);
              if (expired) log.info("Preview {} expired unapplied", changeSet.token());
              return expired;
            });
  }

  private ReconciliationReport applyInTransaction(String runId, ChangeSet changeSet, String operator) {
    ChangePlan previewed = changeSet.plan();

    Set<Long> txIds = previewed.touchedTransactionIds();
    if (!txIds.isEmpty()) {
      transactionRepository.findAllByIdForUpdate(txIds);
    }
    List<Booking> bookings =
        previewed.bookingsToRecompute().isEmpty()
            ? List.of()
            : bookingRepository.findAllByIdForUpdate(previewed.bookingsToRecompute());

    ChangePlan current = planner.plan(changeSet.request(), properties.getPreviewSampleSize());
    if (!current.sameChanges(previewed)) {
      throw new StalePreviewException(
          "Data changed since change set " + changeSet.token() + " was previewed");
    }

    List<FinancialRecord> records = recordRepository.findAllById(previewed.touchedRecordIds());
    List<TransactionLink> links =
        linkRepository.findAllById(
            previewed.unlinks().stream().map(ProposedUnlink::linkId).toList());
    int backupRows = backupService.snapshot(runId, bookings, records, links);

    List<Long> removedLinkIds = new ArrayList<>();
    for (ProposedUnlink unlink : previewed.unlinks()) {
      removedLinkIds.add(
          linkLedgerService.detach(unlink.externalTransactionId(), operator).link().getId());
    }

    List<Long> pairIds = new ArrayList<>();
    for (ProposedPair proposed : previewed.pairs()) {
      ReversalPair pair =
          new ReversalPair(proposed.originalTransactionId(), proposed.reversingTransactionId(), operator);
      pair.setRunId(runId);
      pairIds.add(reversalPairRepository.save(pair).getId());
    }

    List<Long> createdLinkIds = new ArrayList<>();
    for (ProposedLink proposed : previewed.links()) {
      String createdBy =
          proposed.matchType() == TransactionLink.MatchType.MANUAL
              ? operator
              : properties.getProcessTag();
      TransactionLink link =
          linkLedgerService.link(
              new LinkRequest(
                  proposed.externalTransactionId(),
                  proposed.financialRecordId(),
                  proposed.matchType(),
                  proposed.confidence(),
                  createdBy,
                  proposed.assignBookingId(),
                  runId));
      createdLinkIds.add(link.getId());
    }

    List<BalanceChange> balanceChanges = new ArrayList<>();
    List<Long> flagged = new ArrayList<>();
    for (Long bookingId : previewed.bookingsToRecompute()) {
      balanceRecalculator
          .recomputeOrFlag(bookingId)
          .ifPresentOrElse(
              balance -> {
                if (balance.changed()) balanceChanges.add(BalanceChange.of(balance));
              },
              () -> flagged.add(bookingId));
    }

    ReconciliationRun run =
        new ReconciliationRun(runId, RunStatus.APPLIED, operator, changeSet.previewedAt());
    run.setLinksCreated(createdLinkIds.size());
    run.setLinksRemoved(removedLinkIds.size());
    run.setReversalPairs(pairIds.size());
    run.setBalancesChanged(balanceChanges.size());
    run.setErrorCount(previewed.errorCount());
    runRepository.save(run);

    auditService.logEvent(
        operator,
        "APPLY",
        "ReconciliationRun",
        runId,
        "Created "
            + createdLinkIds.size()
            + " links, removed "
            + removedLinkIds.size()
            + ", "
            + pairIds.size()
            + " reversal pairs, "
            + balanceChanges.size()
            + " balances changed, "
            + backupRows
            + " rows backed up");

    return new ReconciliationReport(
        runId,
        ReconciliationReport.Mode.APPLIED,
        previewed.outcomes(),
        createdLinkIds,
        removedLinkIds,
        pairIds,
        balanceChanges,
        flagged,
        previewed.errors(),
        backupRows);
  }

  private void recordAbort(String runId, ChangeSet changeSet, String operator, RuntimeException cause) {
    log.error("Run {} aborted, no changes committed: {}", runId, cause.getMessage(), cause);
    try {
      abortTransaction.executeWithoutResult(
          status -> {
            ReconciliationRun run =
                new ReconciliationRun(runId, RunStatus.ABORTED, operator, changeSet.previewedAt());
            run.setErrorCount(changeSet.plan().errorCount() + 1);
            String message = String.valueOf(cause.getMessage());
            run.setFailureMessage(message.length() > 1000 ? message.substring(0, 1000) : message);
            runRepository.save(run);
            auditService.logEvent(operator, "APPLY_ABORTED", "ReconciliationRun", runId, message);
          });
    } catch (RuntimeException e) {
      log.error("Could not record aborted run {}", runId, e);
      cause.addSuppressed(e);
    }
  }
}
