package com.example.reconciliation.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A charter reservation. {@code paidAmount} and {@code balance} are derived from the payments that
 * reference the booking and are only ever written by the balance recalculator.
 */
@Entity
@Table(
    name = "booking",
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_booking_reserve_number", columnNames = "reserve_number")
    })
public class Booking {

  public enum BookingStatus {
    ACTIVE,
    CLOSED,
    CANCELLED
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Size(max = 20)
  @Column(name = "reserve_number", nullable = false, length = 20)
  private String reserveNumber;

  @Column(name = "charter_date")
  private LocalDate charterDate;

  // Null means the charges were never entered; never treated as zero
  @Column(name = "total_due", precision = 19, scale = 2)
  private BigDecimal totalDue;

  @NotNull
  @Column(name = "paid_amount", nullable = false, precision = 19, scale = 2)
  private BigDecimal paidAmount = BigDecimal.ZERO;

  @Column(precision = 19, scale = 2)
  private BigDecimal balance;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private BookingStatus status = BookingStatus.ACTIVE;

  /** Set when a recalculation could not run; cleared by the next successful one. */
  @Column(name = "needs_review", nullable = false)
  private boolean needsReview;

  @Size(max = 500)
  @Column(name = "review_note", length = 500)
  private String reviewNote;

  @Column(name = "balance_recalculated_at")
  private Instant balanceRecalculatedAt;

  @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
  private List<BookingCharge> charges = new ArrayList<>();

  // Constructors
  public Booking() {}

  public Booking(String reserveNumber, BigDecimal totalDue) {
    this.reserveNumber = reserveNumber;
    this.totalDue = totalDue;
  }

  // Helper methods
  public boolean isCancelled() {
    return status == BookingStatus.CANCELLED;
  }

  public void addCharge(BookingCharge charge) {
    charges.add(charge);
    charge.setBooking(this);
  }

  /** Stores freshly derived amounts and clears any outstanding review flag. */
  public void applyBalance(BigDecimal paidAmount, BigDecimal balance) {
    this.paidAmount = paidAmount;
    this.balance = balance;
    this.needsReview = false;
    this.reviewNote = null;
    this.balanceRecalculatedAt = Instant.now();
  }

  public void flagForReview(String note) {
    this.needsReview = true;
    this.reviewNote = note;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getReserveNumber() {
    return reserveNumber;
  }

  public void setReserveNumber(String reserveNumber) {
    this.reserveNumber = reserveNumber;
  }

  public LocalDate getCharterDate() {
    return charterDate;
  }

  public void setCharterDate(LocalDate charterDate) {
    this.charterDate = charterDate;
  }

  public BigDecimal getTotalDue() {
    return totalDue;
  }

  public void setTotalDue(BigDecimal totalDue) {
    this.totalDue = totalDue;
  }

  public BigDecimal getPaidAmount() {
    return paidAmount;
  }

  public BigDecimal getBalance() {
    return balance;
  }

  public BookingStatus getStatus() {
    return status;
  }

  public void setStatus(BookingStatus status) {
    this.status = status;
  }

  public boolean isNeedsReview() {
    return needsReview;
  }

  public String getReviewNote() {
    return reviewNote;
  }

  public Instant getBalanceRecalculatedAt() {
    return balanceRecalculatedAt;
  }

  public List<BookingCharge> getCharges() {
    return charges;
  }
}
