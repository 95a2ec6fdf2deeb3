package com.example.reconciliation.service.exception;

/**
 * The change-set handed to apply was not issued by this process, was already applied, or no longer
 * describes the stored data.
 */
public class StalePreviewException extends ReconciliationException {

  public StalePreviewException(String message) {
    super(message);
  }
}
