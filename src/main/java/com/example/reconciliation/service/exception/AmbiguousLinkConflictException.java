package com.example.reconciliation.service.exception;

/**
 * The bank line is already linked to a different financial record. Requires a person to decide
 * which link is right; nothing is changed automatically.
 */
public class AmbiguousLinkConflictException extends LinkConflictException {

  private final Long existingRecordId;
  private final Long requestedRecordId;

  public AmbiguousLinkConflictException(
      Long externalTransactionId, Long existingLinkId, Long existingRecordId, Long requestedRecordId) {
    super(
        String.format(
            "Bank transaction %d is already linked to record %d (link %d), cannot link to record %d",
            externalTransactionId, existingRecordId, existingLinkId, requestedRecordId),
        externalTransactionId,
        existingLinkId);
    this.existingRecordId = existingRecordId;
    this.requestedRecordId = requestedRecordId;
  }

  public Long getExistingRecordId() {
    return existingRecordId;
  }

  public Long getRequestedRecordId() {
    return requestedRecordId;
  }
}
