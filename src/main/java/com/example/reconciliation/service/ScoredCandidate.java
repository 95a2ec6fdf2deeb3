package com.example.reconciliation.service;

import java.math.BigDecimal;

import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.TransactionLink.MatchType;

/** A candidate record with its score against one bank line. */
public record ScoredCandidate(
    FinancialRecord record,
    BigDecimal score,
    BigDecimal amountDelta,
    long dateDelta,
    MatchType matchType) {

  public Long recordId() {
    return record.getId();
  }
}
