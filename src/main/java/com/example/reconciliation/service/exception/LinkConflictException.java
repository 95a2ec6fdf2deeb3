package com.example.reconciliation.service.exception;

/** The bank line or the financial record already takes part in a live link. */
public class LinkConflictException extends ReconciliationException {

  private final Long externalTransactionId;
  private final Long existingLinkId;

  public LinkConflictException(String message, Long externalTransactionId, Long existingLinkId) {
    super(message);
    this.externalTransactionId = externalTransactionId;
    this.existingLinkId = existingLinkId;
  }

  public Long getExternalTransactionId() {
    return externalTransactionId;
  }

  public Long getExistingLinkId() {
    return existingLinkId;
  }
}
