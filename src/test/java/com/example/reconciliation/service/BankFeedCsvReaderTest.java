package com.example.reconciliation.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.reconciliation.domain.CounterpartyType;

class BankFeedCsvReaderTest {

  private final BankFeedCsvReader reader = new BankFeedCsvReader();

  @Test
  void read_SignedAmountColumn_ReturnsDraftsInFileOrder() {
    String csv =
        """
        Date,Description,Amount
        2024-05-01,E-TRANSFER ALICE,200.00
        05/02/2024,"POS PURCHASE, SHELL",(45.10)
        """;

    List<ExternalTransactionDraft> drafts = reader.read("1010", csv);

    assertEquals(2, drafts.size());
    assertEquals(LocalDate.of(2024, 5, 1), drafts.get(0).transactionDate());
    assertEquals(new BigDecimal("200.00"), drafts.get(0).amount());
    assertEquals(CounterpartyType.E_TRANSFER, drafts.get(0).counterpartyType());
    assertEquals("1010", drafts.get(0).sourceAccount());

    assertEquals(LocalDate.of(2024, 5, 2), drafts.get(1).transactionDate());
    assertEquals(new BigDecimal("-45.10"), drafts.get(1).amount());
    assertEquals("POS PURCHASE, SHELL", drafts.get(1).description());
    assertEquals(CounterpartyType.CARD, drafts.get(1).counterpartyType());
  }

  @Test
  void read_DebitAndCreditAmountColumns_ComputesSignedAmount() {
    String csv =
        """
        Posted Date,Details,Debit Amount,Credit Amount
        2024-05-01,CHQ 104,150.00,
        2024-05-02,DEPOSIT,,500.00
        """;

    List<ExternalTransactionDraft> drafts = reader.read("1010", csv);

    assertEquals(new BigDecimal("-150.00"), drafts.get(0).amount());
    assertEquals(CounterpartyType.CHEQUE, drafts.get(0).counterpartyType());
    assertEquals(new BigDecimal("500.00"), drafts.get(1).amount());
    // DEPOSIT contains POS but is not a card payment
    assertEquals(CounterpartyType.UNKNOWN, drafts.get(1).counterpartyType());
  }

  @Test
  void read_UnparseableDate_KeepsLineWithNullDate() {
    String csv =
        """
        Date,Description,Amount
        someday,WIRE IN,1000.00
        """;

    List<ExternalTransactionDraft> drafts = reader.read("1010", csv);

    assertEquals(1, drafts.size());
    assertNull(drafts.get(0).transactionDate());
    assertEquals("someday,WIRE IN,1000.00", drafts.get(0).rawContent());
  }

  @Test
  void read_UnknownHeader_ThrowsException() {
    assertThrows(IllegalArgumentException.class, () -> reader.read("1010", "Foo,Bar\n1,2\n"));
  }

  @Test
  void detectCounterpartyType_TypeColumn_TakesPartInDetection() {
    assertEquals(CounterpartyType.BANK_TRANSFER, reader.detectCounterpartyType("EFT", "PAYROLL"));
    assertEquals(CounterpartyType.E_TRANSFER, reader.detectCounterpartyType(null, "INTERAC EMT 7731"));
    assertEquals(CounterpartyType.UNKNOWN, reader.detectCounterpartyType(null, null));
  }
}
