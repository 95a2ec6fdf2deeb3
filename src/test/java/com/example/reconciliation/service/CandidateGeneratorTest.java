package com.example.reconciliation.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.reconciliation.config.MatchingPolicy;
import com.example.reconciliation.domain.CounterpartyType;
import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.FinancialRecord.RecordType;

class CandidateGeneratorTest {

  private CandidateGenerator candidateGenerator;

  @BeforeEach
  void setUp() {
    candidateGenerator = new CandidateGenerator(MatchingPolicy.defaults());
  }

  private ExternalTransaction bankLine(String date, String amount, CounterpartyType type) {
    ExternalTransaction tx =
        new ExternalTransaction(
            null, LocalDate.parse(date), new BigDecimal(amount), "BANK LINE", "1010", "fp-tx");
    tx.setId(1L);
    tx.setCounterpartyType(type);
    return tx;
  }

  private FinancialRecord record(long id, RecordType type, String amount, String date) {
    FinancialRecord record =
        new FinancialRecord(type, new BigDecimal(amount), LocalDate.parse(date), "Record " + id);
    record.setId(id);
    return record;
  }

  @Test
  void candidates_CardPurchase_KeepsExactAmountsWithinWindowOrderedByDateDelta() {
    ExternalTransaction tx = bankLine("2024-05-10", "-45.10", CounterpartyType.CARD);
    List<FinancialRecord> pool =
        List.of(
            record(1L, RecordType.RECEIPT, "45.10", "2024-05-09"),
            record(2L, RecordType.RECEIPT, "45.10", "2024-05-20"), // outside window
            record(3L, RecordType.PAYMENT, "45.10", "2024-05-10"), // money in, wrong direction
            record(4L, RecordType.RECEIPT, "45.11", "2024-05-10"), // off by a cent
            record(5L, RecordType.RECEIPT, "45.10", "2024-05-10"));

    List<Long> ids = candidateGenerator.candidates(tx, pool).map(FinancialRecord::getId).toList();

    assertEquals(List.of(5L, 1L), ids);
  }

  @Test
  void candidates_ETransfer_AllowsAmountToleranceAndWideWindow() {
    ExternalTransaction tx = bankLine("2024-05-01", "200.00", CounterpartyType.E_TRANSFER);
    List<FinancialRecord> pool =
        List.of(
            record(1L, RecordType.PAYMENT, "199.50", "2024-05-13"),
            record(2L, RecordType.PAYMENT, "198.00", "2024-05-01"),
            record(3L, RecordType.PAYMENT, "200.00", "2024-05-14"));

    List<Long> ids = candidateGenerator.candidates(tx, pool).map(FinancialRecord::getId).toList();

    // Smaller amount difference ranks first even though the date is further away
    assertEquals(List.of(3L, 1L), ids);
  }

  @Test
  void candidates_EqualDeltas_OrderedById() {
    ExternalTransaction tx = bankLine("2024-05-01", "300.00", CounterpartyType.UNKNOWN);
    List<FinancialRecord> pool =
        List.of(
            record(9L, RecordType.PAYMENT, "300.00", "2024-05-01"),
            record(4L, RecordType.PAYMENT, "300.00", "2024-05-01"));

    List<Long> ids = candidateGenerator.candidates(tx, pool).map(FinancialRecord::getId).toList();

    assertEquals(List.of(4L, 9L), ids);
  }

  @Test
  void candidates_EmptyPool_ReturnsEmptySequence() {
    ExternalTransaction tx = bankLine("2024-05-01", "300.00", CounterpartyType.UNKNOWN);

    assertEquals(0, candidateGenerator.candidates(tx, List.of()).count());
  }

  @Test
  void searchWindow_WidensRangeByWidestTolerance() {
    CandidateGenerator.DateRange range =
        candidateGenerator.searchWindow(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31));

    assertEquals(LocalDate.of(2024, 4, 1), range.from());
    assertEquals(LocalDate.of(2024, 6, 30), range.to());
  }
}
