package com.example.reconciliation.domain;

/**
 * Kind of money movement behind a bank line. Drives the date window and amount tolerance used when
 * looking for counterpart records.
 */
public enum CounterpartyType {
  CARD, // Debit/credit card settlement, posts within a few days at the exact amount
  BANK_TRANSFER, // Internal or wire transfer
  E_TRANSFER, // Interac e-transfer, prone to fee rounding and late deposit
  CHEQUE, // Cheque, can clear weeks after it was written
  LEGACY_IMPORT, // Manually keyed historical data
  UNKNOWN
}
