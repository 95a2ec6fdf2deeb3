package com.example.reconciliation.service.exception;

/** Base type for failures raised by the reconciliation core. */
public class ReconciliationException extends RuntimeException {

  public ReconciliationException(String message) {
    super(message);
  }

  public ReconciliationException(String message, Throwable cause) {
    super(message, cause);
  }
}
