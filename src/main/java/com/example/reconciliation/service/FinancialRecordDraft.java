package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.reconciliation.domain.FinancialRecord.RecordType;
import com.example.reconciliation.domain.Fingerprintable;

/**
 * A receipt or payment as delivered by another system, before it is fingerprinted.
 *
 * @param sourceSystem originating system, or the bank account for records created from bank lines
 * @param reserveNumber booking the payment is for, if known
 */
public record FinancialRecordDraft(
    RecordType recordType,
    LocalDate recordDate,
    BigDecimal amount,
    String description,
    String vendorName,
    String referenceCode,
    String sourceSystem,
    String reserveNumber,
    String rawContent)
    implements Fingerprintable {

  @Override
  public LocalDate getTransactionDate() {
    return recordDate;
  }

  /** The amount in bank terms, so a record keyed from a bank line shares that line's key. */
  @Override
  public BigDecimal getAmount() {
    if (amount == null || recordType == null) return amount;
    return recordType == RecordType.RECEIPT ? amount.negate() : amount;
  }

  @Override
  public String getDescription() {
    return description;
  }

  @Override
  public String getSourceAccount() {
    return sourceSystem;
  }
}
