package com.example.reconciliation.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.example.reconciliation.domain.Fingerprintable;
import com.example.reconciliation.service.exception.MissingFieldException;

/**
 * Computes the content fingerprint every import path deduplicates on. The key covers date, amount
 * (to the cent), normalized description and source account, so re-reading the same source data
 * always yields the same key.
 */
@Service
public class FingerprintService {

  private static final String SEPARATOR = "|";

  /**
   * Fingerprints a record.
   *
   * @throws MissingFieldException if any of the four source fields is absent or blank
   */
  public FingerprintKey fingerprint(Fingerprintable record) {
    List<String> missing = new ArrayList<>();
    if (record.getTransactionDate() == null) missing.add("date");
    if (record.getAmount() == null) missing.add("amount");
    String description = normalizeDescription(record.getDescription());
    if (description.isEmpty()) missing.add("description");
    String account = record.getSourceAccount() != null ? record.getSourceAccount().trim() : "";
    if (account.isEmpty()) missing.add("sourceAccount");

    if (!missing.isEmpty()) {
      throw new MissingFieldException(missing);
    }

    String canonical =
        record.getTransactionDate()
            + SEPARATOR
            + normalizeAmount(record.getAmount())
            + SEPARATOR
            + description
            + SEPARATOR
            + account.toUpperCase(Locale.ROOT);
    return new FingerprintKey(sha256(canonical));
  }

  /** Upper-cases, collapses whitespace runs and trims. Null becomes the empty string. */
  static String normalizeDescription(String description) {
    if (description == null) return "";
    return description.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
  }

  static String normalizeAmount(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  private String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder();
      for (byte b : hash) {
        hex.append(String.format("%02x", b));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
