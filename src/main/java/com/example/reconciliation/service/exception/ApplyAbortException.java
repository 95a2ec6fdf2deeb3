package com.example.reconciliation.service.exception;

/** An apply batch failed and was rolled back in full. */
public class ApplyAbortException extends ReconciliationException {

  private final String runId;

  public ApplyAbortException(String runId, String message, Throwable cause) {
    super("Apply run " + runId + " aborted: " + message, cause);
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }
}
