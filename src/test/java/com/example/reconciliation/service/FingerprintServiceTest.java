package com.example.reconciliation.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.example.reconciliation.domain.FinancialRecord.RecordType;
import com.example.reconciliation.service.exception.MissingFieldException;

class FingerprintServiceTest {

  private final FingerprintService fingerprintService = new FingerprintService();

  private ExternalTransactionDraft line(String date, String amount, String description, String account) {
    return new ExternalTransactionDraft(
        date != null ? LocalDate.parse(date) : null,
        amount != null ? new BigDecimal(amount) : null,
        description,
        account,
        null,
        null,
        null);
  }

  @Test
  void fingerprint_IdenticalInput_ReturnsSameKey() {
    FingerprintKey first = fingerprintService.fingerprint(line("2024-05-01", "200.00", "E-TRANSFER", "1010"));
    FingerprintKey second = fingerprintService.fingerprint(line("2024-05-01", "200.00", "E-TRANSFER", "1010"));

    assertEquals(first, second);
    assertEquals(64, first.value().length());
  }

  @Test
  void fingerprint_CosmeticDifferences_ReturnsSameKey() {
    FingerprintKey plain = fingerprintService.fingerprint(line("2024-05-01", "200", "E-TRANSFER  ALICE", "1010"));
    FingerprintKey noisy = fingerprintService.fingerprint(line("2024-05-01", "200.00", "  e-transfer alice ", " 1010 "));

    assertEquals(plain, noisy);
  }

  @Test
  void fingerprint_DifferentAmountOrAccount_ReturnsDifferentKey() {
    FingerprintKey base = fingerprintService.fingerprint(line("2024-05-01", "200.00", "E-TRANSFER", "1010"));

    assertNotEquals(base, fingerprintService.fingerprint(line("2024-05-01", "200.01", "E-TRANSFER", "1010")));
    assertNotEquals(base, fingerprintService.fingerprint(line("2024-05-01", "200.00", "E-TRANSFER", "2020")));
    assertNotEquals(base, fingerprintService.fingerprint(line("2024-05-02", "200.00", "E-TRANSFER", "1010")));
  }

  @Test
  void fingerprint_MissingFields_ThrowsWithEveryMissingField() {
    MissingFieldException e =
        assertThrows(
            MissingFieldException.class,
            () -> fingerprintService.fingerprint(line(null, null, "   ", "1010")));

    assertEquals(3, e.getMissingFields().size());
    assertTrue(e.getMissingFields().contains("date"));
    assertTrue(e.getMissingFields().contains("amount"));
    assertTrue(e.getMissingFields().contains("description"));
  }

  @Test
  void fingerprint_ReceiptKeyedFromBankLine_MatchesBankLineKey() {
    // A receipt is money out, so the bank line carries the negated amount
    FinancialRecordDraft receipt =
        new FinancialRecordDraft(
            RecordType.RECEIPT,
            LocalDate.parse("2024-05-03"),
            new BigDecimal("45.10"),
            "SHELL 4412",
            "Shell",
            null,
            "1010",
            null,
            null);

    assertEquals(
        fingerprintService.fingerprint(line("2024-05-03", "-45.10", "SHELL 4412", "1010")),
        fingerprintService.fingerprint(receipt));
  }
}
