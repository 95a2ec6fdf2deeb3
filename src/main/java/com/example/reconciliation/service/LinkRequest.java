package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.util.Objects;

import com.example.reconciliation.domain.TransactionLink.MatchType;

/**
 * A request to link one bank line to one financial record.
 *
 * @param assignBookingId if set, the record is pointed at this booking by the link (only allowed
 *     when the record has no booking yet)
 * @param runId the reconciliation run writing the link, null outside a run
 */
public record LinkRequest(
    Long externalTransactionId,
    Long financialRecordId,
    MatchType matchType,
    BigDecimal confidence,
    String createdBy,
    Long assignBookingId,
    String runId) {

  public LinkRequest {
    Objects.requireNonNull(externalTransactionId, "Transaction id cannot be null");
    Objects.requireNonNull(financialRecordId, "Financial record id cannot be null");
    Objects.requireNonNull(matchType, "Match type cannot be null");
    Objects.requireNonNull(confidence, "Confidence cannot be null");
    if (confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException("Confidence must be between 0 and 1: " + confidence);
    }
  }

  public static LinkRequest of(
      Long externalTransactionId,
      Long financialRecordId,
      MatchType matchType,
      BigDecimal confidence,
      String createdBy) {
    return new LinkRequest(
        externalTransactionId, financialRecordId, matchType, confidence, createdBy, null, null);
  }
}
