package com.example.reconciliation.service;

import java.util.Objects;

/** Hex SHA-256 of a record's canonical immutable fields. */
public record FingerprintKey(String value) {

  public FingerprintKey {
    Objects.requireNonNull(value, "Fingerprint value cannot be null");
    if (value.length() != 64) {
      throw new IllegalArgumentException("Fingerprint must be a 64 character SHA-256 hex string");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
