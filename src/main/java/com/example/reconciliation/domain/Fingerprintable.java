package com.example.reconciliation.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Immutable source fields a content fingerprint is computed from. */
public interface Fingerprintable {

  LocalDate getTransactionDate();

  /** Signed as the money moves through the bank: positive in, negative out. */
  BigDecimal getAmount();

  String getDescription();

  /** Bank account number, or the originating system for internally keyed records. */
  String getSourceAccount();
}
