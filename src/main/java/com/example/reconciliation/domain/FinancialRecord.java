package com.example.reconciliation.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Money recognized on the business side: an expense receipt or a customer payment. Payments may
 * reference the booking they pay for. Many records legitimately never get a bank counterpart (cash
 * expenses, cash deposits).
 */
@Entity
@Table(
    name = "financial_record",
    indexes = {
      @Index(name = "idx_fin_record_type_date", columnList = "record_type, record_date"),
      @Index(name = "idx_fin_record_booking", columnList = "booking_id")
    },
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_fin_record_fingerprint", columnNames = "fingerprint")
    })
public class FinancialRecord {

  public enum RecordType {
    RECEIPT, // Expense, settled by money leaving the bank
    PAYMENT // Customer payment, settled by money arriving in the bank
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "record_type", nullable = false, length = 20)
  private RecordType recordType;

  // Positive for the normal direction of the record type; refunds are negative
  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @NotNull
  @Column(name = "record_date", nullable = false)
  private LocalDate recordDate;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @Size(max = 200)
  @Column(name = "vendor_name", length = 200)
  private String vendorName;

  /** E-transfer reference, cheque number or similar token that may show up on the bank line. */
  @Size(max = 100)
  @Column(name = "reference_code", length = 100)
  private String referenceCode;

  @Size(max = 100)
  @Column(name = "source_system", length = 100)
  private String sourceSystem;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "booking_id")
  private Booking booking;

  /** Id of the link that assigned {@link #booking}, or null if the reference predates any link. */
  @Column(name = "booking_assigned_by_link_id")
  private Long bookingAssignedByLinkId;

  @Size(max = 64)
  @Column(length = 64)
  private String fingerprint;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "import_batch_id")
  private ImportBatch importBatch;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public FinancialRecord() {}

  public FinancialRecord(
      RecordType recordType, BigDecimal amount, LocalDate recordDate, String description) {
    this.recordType = recordType;
    this.amount = amount;
    this.recordDate = recordDate;
    this.description = description;
  }

  // Helper methods
  public boolean isPayment() {
    return recordType == RecordType.PAYMENT;
  }

  /**
   * Amount as it would appear on a bank line: payments are deposits (positive), receipts are
   * withdrawals (negative).
   */
  public BigDecimal getBankSignedAmount() {
    return isPayment() ? amount : amount.negate();
  }

  public Long getBookingId() {
    return booking != null ? booking.getId() : null;
  }

  /** Points the record at a booking on behalf of a link, so the link can undo it later. */
  public void assignBookingByLink(Booking booking, Long linkId) {
    this.booking = booking;
    this.bookingAssignedByLinkId = linkId;
  }

  /** Drops the booking reference if, and only if, the given link is the one that set it. */
  public boolean releaseBookingAssignedBy(Long linkId) {
    if (linkId == null || !linkId.equals(bookingAssignedByLinkId)) {
      return false;
    }
    this.booking = null;
    this.bookingAssignedByLinkId = null;
    return true;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public RecordType getRecordType() {
    return recordType;
  }

  public void setRecordType(RecordType recordType) {
    this.recordType = recordType;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public void setAmount(BigDecimal amount) {
    this.amount = amount;
  }

  public LocalDate getRecordDate() {
    return recordDate;
  }

  public void setRecordDate(LocalDate recordDate) {
    this.recordDate = recordDate;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getVendorName() {
    return vendorName;
  }

  public void setVendorName(String vendorName) {
    this.vendorName = vendorName;
  }

  public String getReferenceCode() {
    return referenceCode;
  }

  public void setReferenceCode(String referenceCode) {
    this.referenceCode = referenceCode;
  }

  public String getSourceSystem() {
    return sourceSystem;
  }

  public void setSourceSystem(String sourceSystem) {
    this.sourceSystem = sourceSystem;
  }

  public Booking getBooking() {
    return booking;
  }

  public void setBooking(Booking booking) {
    this.booking = booking;
    this.bookingAssignedByLinkId = null;
  }

  public Long getBookingAssignedByLinkId() {
    return bookingAssignedByLinkId;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public void setFingerprint(String fingerprint) {
    this.fingerprint = fingerprint;
  }

  public ImportBatch getImportBatch() {
    return importBatch;
  }

  public void setImportBatch(ImportBatch importBatch) {
    this.importBatch = importBatch;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
