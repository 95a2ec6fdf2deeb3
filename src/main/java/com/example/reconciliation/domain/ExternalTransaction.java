package com.example.reconciliation.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A single line from a bank feed. Amount, date, description and source account never change after
 * import; a correction arrives as a new line (usually paired with a reversal). Positive amounts are
 * deposits, negative amounts are withdrawals.
 */
@Entity
@Table(
    name = "external_transaction",
    indexes = {
      @Index(name = "idx_ext_tx_account_date", columnList = "source_account, transaction_date"),
      @Index(name = "idx_ext_tx_batch", columnList = "import_batch_id")
    },
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_ext_tx_fingerprint", columnNames = "fingerprint")
    })
public class ExternalTransaction implements Fingerprintable {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "import_batch_id", nullable = false, updatable = false)
  private ImportBatch importBatch;

  @NotNull
  @Column(name = "transaction_date", nullable = false, updatable = false)
  private LocalDate transactionDate;

  @NotNull
  @Column(nullable = false, updatable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @Size(max = 500)
  @Column(length = 500, updatable = false)
  private String description;

  @NotNull
  @Size(max = 100)
  @Column(name = "source_account", nullable = false, length = 100, updatable = false)
  private String sourceAccount;

  @Size(max = 200)
  @Column(name = "counterparty_name", length = 200)
  private String counterpartyName;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "counterparty_type", nullable = false, length = 20)
  private CounterpartyType counterpartyType = CounterpartyType.UNKNOWN;

  @NotNull
  @Size(max = 64)
  @Column(nullable = false, length = 64, updatable = false)
  private String fingerprint;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  protected ExternalTransaction() {}

  public ExternalTransaction(
      ImportBatch importBatch,
      LocalDate transactionDate,
      BigDecimal amount,
      String description,
      String sourceAccount,
      String fingerprint) {
    this.importBatch = importBatch;
    this.transactionDate = transactionDate;
    this.amount = amount;
    this.description = description;
    this.sourceAccount = sourceAccount;
    this.fingerprint = fingerprint;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public ImportBatch getImportBatch() {
    return importBatch;
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

  public String getCounterpartyName() {
    return counterpartyName;
  }

  public void setCounterpartyName(String counterpartyName) {
    this.counterpartyName = counterpartyName;
  }

  public CounterpartyType getCounterpartyType() {
    return counterpartyType;
  }

  public void setCounterpartyType(CounterpartyType counterpartyType) {
    this.counterpartyType = counterpartyType;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /** Returns true if this is an inflow (deposit/receipt). */
  public boolean isInflow() {
    return amount != null && amount.compareTo(BigDecimal.ZERO) > 0;
  }

  /** Returns true if this is an outflow (withdrawal/payment). */
  public boolean isOutflow() {
    return amount != null && amount.compareTo(BigDecimal.ZERO) < 0;
  }
}
