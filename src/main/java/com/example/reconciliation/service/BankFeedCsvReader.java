package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.reconciliation.domain.CounterpartyType;

/**
 * Reads common bank CSV exports into import drafts. Expects a header row with a date column, a
 * description column and either an amount column or debit/credit columns.
 *
 * <p>Lines whose date or amount cannot be read are still returned, with the unreadable field left
 * null, so that the import quarantines them instead of losing them.
 */
@Service
public class BankFeedCsvReader {

  private static final Logger log = LoggerFactory.getLogger(BankFeedCsvReader.class);

  private static final List<DateTimeFormatter> DATE_FORMATS =
      List.of(
          DateTimeFormatter.ofPattern("yyyy-MM-dd"),
          DateTimeFormatter.ofPattern("MM/dd/yyyy"),
          DateTimeFormatter.ofPattern("M/d/yyyy"),
          DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH));

  /**
   * Parses the file content.
   *
   * @param sourceAccount account the statement belongs to, stamped on every draft
   * @param content file content
   * @return one draft per data line, in file order
   * @throws IllegalArgumentException if the header does not identify date and amount columns
   */
  public List<ExternalTransactionDraft> read(String sourceAccount, String content) {
    List<ExternalTransactionDraft> drafts = new ArrayList<>();
    String[] lines = content.split("\\r?\\n");
    if (lines.length < 2) return drafts;

    String[] headers = parseCsvLine(lines[0]);
    int dateCol = findColumn(headers, "date", "posted");
    int descCol = findColumn(headers, "description", "payee", "name", "memo", "details");
    int debitCol = findColumn(headers, "debit", "withdrawal");
    int creditCol = findColumn(headers, "credit", "deposit");
    // "Debit Amount"/"Credit Amount" style headers are split columns, not a signed amount
    int amountCol = debitCol < 0 && creditCol < 0 ? findColumn(headers, "amount", "value") : -1;
    int typeCol = findColumn(headers, "type", "channel");

    if (dateCol < 0 || (amountCol < 0 && debitCol < 0 && creditCol < 0)) {
      throw new IllegalArgumentException("CSV format not recognized - missing date or amount columns");
    }

    for (int i = 1; i < lines.length; i++) {
      if (lines[i].isBlank()) continue;
      String[] values = parseCsvLine(lines[i]);

      LocalDate date = parseDate(valueAt(values, dateCol));
      String description = valueAt(values, descCol);
      CounterpartyType type = detectCounterpartyType(valueAt(values, typeCol), description);

      ExternalTransactionDraft draft;
      if (amountCol >= 0) {
        draft =
            new ExternalTransactionDraft(
                date,
                parseAmount(valueAt(values, amountCol)),
                description,
                sourceAccount,
                null,
                type,
                lines[i]);
      } else {
        ExternalTransactionDraft split =
            ExternalTransactionDraft.fromDebitCredit(
                date,
                parseAmount(valueAt(values, debitCol)),
                parseAmount(valueAt(values, creditCol)),
                description,
                sourceAccount,
                lines[i]);
        draft =
            new ExternalTransactionDraft(
                split.transactionDate(),
                split.amount(),
                split.description(),
                split.sourceAccount(),
                null,
                type,
                split.rawContent());
      }
      drafts.add(draft);
    }

    log.debug("Read {} lines for account {}", drafts.size(), sourceAccount);
    return drafts;
  }

  /** Guesses the counterparty type from an explicit type column or the description text. */
  CounterpartyType detectCounterpartyType(String typeValue, String description) {
    String text =
        " " + ((typeValue != null ? typeValue : "") + " " + (description != null ? description : ""))
            .toUpperCase(Locale.ROOT)
            .replaceAll("[^A-Z0-9-]+", " ")
            + " ";
    if (containsAny(text, "E-TRANSFER", "E TRANSFER", "INTERAC", "EMT")) {
      return CounterpartyType.E_TRANSFER;
    }
    if (containsAny(text, "CHEQUE", "CHQ")) return CounterpartyType.CHEQUE;
    if (containsAny(text, "POS", "VISA", "MASTERCARD", "DEBIT CARD")) {
      return CounterpartyType.CARD;
    }
    if (containsAny(text, "TRANSFER", "WIRE", "EFT")) return CounterpartyType.BANK_TRANSFER;
    return CounterpartyType.UNKNOWN;
  }

  // Whole-word match against a space-padded string
  private boolean containsAny(String paddedText, String... words) {
    for (String word : words) {
      if (paddedText.contains(" " + word + " ")) return true;
    }
    return false;
  }

  private String valueAt(String[] values, int col) {
    if (col < 0 || col >= values.length) return null;
    String value = values[col].trim();
    return value.isEmpty() ? null : value;
  }

  private LocalDate parseDate(String value) {
    if (value == null) return null;
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return LocalDate.parse(value, format);
      } catch (DateTimeParseException ignored) {
        // try the next format
      }
    }
    log.warn("Could not parse date: {}", value);
    return null;
  }

  private BigDecimal parseAmount(String value) {
    if (value == null) return null;
    boolean parenthesized = value.startsWith("(") && value.endsWith(")");
    // Remove currency symbols, commas, and whitespace
    String cleaned = value.replaceAll("[^0-9.\\-]", "");
    if (cleaned.isEmpty()) return null;
    try {
      BigDecimal amount = new BigDecimal(cleaned);
      return parenthesized ? amount.negate() : amount;
    } catch (NumberFormatException e) {
      log.warn("Could not parse amount: {}", value);
      return null;
    }
  }

  private String[] parseCsvLine(String line) {
    List<String> values = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inQuotes = false;

    for (char c : line.toCharArray()) {
      if (c == '"') {
        inQuotes = !inQuotes;
      } else if (c == ',' && !inQuotes) {
        values.add(current.toString().trim());
        current = new StringBuilder();
      } else {
        current.append(c);
      }
    }
    values.add(current.toString().trim());

    return values.toArray(new String[0]);
  }

  private int findColumn(String[] headers, String... names) {
    for (int i = 0; i < headers.length; i++) {
      String header = headers[i].toLowerCase(Locale.ROOT).trim();
      for (String name : names) {
        if (header.contains(name)) {
          return i;
        }
      }
    }
    return -1;
  }
}
