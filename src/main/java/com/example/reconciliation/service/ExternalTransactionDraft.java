package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.reconciliation.domain.CounterpartyType;
import com.example.reconciliation.domain.Fingerprintable;

/**
 * A bank line as delivered by a feed, before it is fingerprinted. Fields may be null; incomplete
 * drafts are quarantined by the import, not dropped.
 *
 * @param rawContent the source line exactly as read, kept for the review queue
 */
public record ExternalTransactionDraft(
    LocalDate transactionDate,
    BigDecimal amount,
    String description,
    String sourceAccount,
    String counterpartyName,
    CounterpartyType counterpartyType,
    String rawContent)
    implements Fingerprintable {

  /**
   * Builds a draft from separate debit and credit magnitudes. The signed amount is credit minus
   * debit; it is null when both are missing.
   */
  public static ExternalTransactionDraft fromDebitCredit(
      LocalDate transactionDate,
      BigDecimal debit,
      BigDecimal credit,
      String description,
      String sourceAccount,
      String rawContent) {
    BigDecimal amount = null;
    if (debit != null || credit != null) {
      amount =
          (credit != null ? credit : BigDecimal.ZERO)
              .subtract(debit != null ? debit : BigDecimal.ZERO);
    }
    return new ExternalTransactionDraft(
        transactionDate, amount, description, sourceAccount, null, null, rawContent);
  }

  /** Returns a copy carrying the given account if this draft has none. */
  public ExternalTransactionDraft withDefaultAccount(String account) {
    if (sourceAccount != null && !sourceAccount.isBlank()) {
      return this;
    }
    return new ExternalTransactionDraft(
        transactionDate, amount, description, account, counterpartyName, counterpartyType, rawContent);
  }

  @Override
  public LocalDate getTransactionDate() {
    return transactionDate;
  }

  @Override
  public BigDecimal getAmount() {
    return amount;
  }

  @Override
  public String getDescription() {
    return description;
  }

  @Override
  public String getSourceAccount() {
    return sourceAccount;
  }
}
