package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.example.reconciliation.domain.BackupSnapshot;
import com.example.reconciliation.domain.Booking;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.TransactionLink;
import com.example.reconciliation.repository.BackupSnapshotRepository;

/**
 * Persists point-in-time copies of rows an apply run is about to change. Snapshots are written in
 * their own transaction so they are durable before the mutation starts and survive its rollback.
 */
@Service
public class BackupService {

  private static final Logger log = LoggerFactory.getLogger(BackupService.class);

  public static final String BOOKING_TABLE = "booking";
  public static final String RECORD_TABLE = "financial_record";
  public static final String LINK_TABLE = "transaction_link";

  private final BackupSnapshotRepository snapshotRepository;
  private final ObjectMapper objectMapper;

  public BackupService(BackupSnapshotRepository snapshotRepository) {
    this.snapshotRepository = snapshotRepository;
    this.objectMapper = new ObjectMapper();
  }

  /**
   * Snapshots every given row under the run id and commits.
   *
   * @return number of rows written
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public int snapshot(
      String runId,
      Collection<Booking> bookings,
      Collection<FinancialRecord> records,
      Collection<TransactionLink> links) {
    List<BackupSnapshot> snapshots = new ArrayList<>();
    for (Booking booking : bookings) {
      snapshots.add(new BackupSnapshot(runId, BOOKING_TABLE, booking.getId(), toJson(booking)));
    }
    for (FinancialRecord record : records) {
      snapshots.add(new BackupSnapshot(runId, RECORD_TABLE, record.getId(), toJson(record)));
    }
    for (TransactionLink link : links) {
      snapshots.add(new BackupSnapshot(runId, LINK_TABLE, link.getId(), toJson(link)));
    }
    snapshotRepository.saveAll(snapshots);
    log.info("Backed up {} rows for run {}", snapshots.size(), runId);
    return snapshots.size();
  }

  @Transactional(readOnly = true)
  public List<BackupSnapshot> findByRun(String runId) {
    return snapshotRepository.findByRunIdOrderByTableNameAscRowIdAsc(runId);
  }

  String toJson(Booking booking) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("id", booking.getId());
    node.put("reserve_number", booking.getReserveNumber());
    node.put("charter_date", booking.getCharterDate() != null ? booking.getCharterDate().toString() : null);
    node.put("total_due", plain(booking.getTotalDue()));
    node.put("paid_amount", plain(booking.getPaidAmount()));
    node.put("balance", plain(booking.getBalance()));
    node.put("status", booking.getStatus().name());
    node.put("needs_review", booking.isNeedsReview());
    node.put("review_note", booking.getReviewNote());
    node.put(
        "balance_recalculated_at",
        booking.getBalanceRecalculatedAt() != null
            ? booking.getBalanceRecalculatedAt().toString()
            : null);
    return write(node);
  }

  String toJson(FinancialRecord record) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("id", record.getId());
    node.put("record_type", record.getRecordType().name());
    node.put("amount", plain(record.getAmount()));
    node.put("record_date", record.getRecordDate().toString());
    node.put("description", record.getDescription());
    node.put("vendor_name", record.getVendorName());
    node.put("reference_code", record.getReferenceCode());
    node.put("source_system", record.getSourceSystem());
    node.put("booking_id", record.getBookingId());
    node.put("booking_assigned_by_link_id", record.getBookingAssignedByLinkId());
    node.put("fingerprint", record.getFingerprint());
    return write(node);
  }

  String toJson(TransactionLink link) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("id", link.getId());
    node.put("external_transaction_id", link.getExternalTransactionId());
    node.put("financial_record_id", link.getFinancialRecordId());
    node.put("match_type", link.getMatchType().name());
    node.put("confidence", plain(link.getConfidence()));
    node.put("assigned_booking_id", link.getAssignedBookingId());
    node.put("run_id", link.getRunId());
    node.put("created_by", link.getCreatedBy());
    node.put("created_at", link.getCreatedAt() != null ? link.getCreatedAt().toString() : null);
    node.put("superseded", link.isSuperseded());
    return write(node);
  }

  private String plain(BigDecimal value) {
    return value != null ? value.toPlainString() : null;
  }

  private String write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      // A backup that cannot be written must stop the apply
      throw new IllegalStateException("Failed to serialize backup row", e);
    }
  }
}
