package com.example.reconciliation.service.exception;

/** A booking's balance cannot be derived because its total due was never set. */
public class IncompleteBookingException extends ReconciliationException {

  private final Long bookingId;

  public IncompleteBookingException(Long bookingId, String reserveNumber) {
    super("Booking " + reserveNumber + " (id " + bookingId + ") has no total due");
    this.bookingId = bookingId;
  }

  public Long getBookingId() {
    return bookingId;
  }
}
