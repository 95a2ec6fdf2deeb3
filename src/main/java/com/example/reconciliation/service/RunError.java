package com.example.reconciliation.service;

import java.util.Objects;

/**
 * A per-record problem collected during an import or a reconciliation run. Errors never stop the
 * batch; they are reported so nothing is skipped silently.
 */
public record RunError(ErrorKind kind, String entityType, String entityId, String message) {

  public enum ErrorKind {
    MISSING_FIELD, // Record quarantined for review
    LINK_CONFLICT, // Record already linked elsewhere
    AMBIGUOUS_LINK_CONFLICT, // Bank line already linked to a different record
    INCOMPLETE_BOOKING, // Booking has no total due, flagged
    CHARGE_MISMATCH, // Charges do not add up to total due (warning)
    NOT_LINKED, // Unlink requested for a bank line without a live link
    NOT_FOUND // Referenced row does not exist
  }

  public RunError {
    Objects.requireNonNull(kind, "Error kind cannot be null");
  }

  public static RunError of(ErrorKind kind, String entityType, Object entityId, String message) {
    return new RunError(kind, entityType, entityId != null ? entityId.toString() : null, message);
  }

  /** Warnings are reported alongside errors but do not mean anything was skipped. */
  public boolean isWarning() {
    return kind == ErrorKind.CHARGE_MISMATCH;
  }
}
