package com.example.reconciliation.service.exception;

import java.util.List;

/**
 * A source record lacks one of the immutable fields its fingerprint is built from. The record goes
 * to the manual-review queue; it is never imported under a placeholder key.
 */
public class MissingFieldException extends ReconciliationException {

  private final List<String> missingFields;

  public MissingFieldException(List<String> missingFields) {
    super("Cannot fingerprint record, missing: " + String.join(", ", missingFields));
    this.missingFields = List.copyOf(missingFields);
  }

  public List<String> getMissingFields() {
    return missingFields;
  }
}
