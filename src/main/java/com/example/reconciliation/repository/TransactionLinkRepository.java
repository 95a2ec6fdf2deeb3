package com.example.reconciliation.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.TransactionLink;

/** Repository for the link ledger. "Active" means not superseded. */
@Repository
public interface TransactionLinkRepository extends JpaRepository<TransactionLink, Long> {

  /** Find the live link for a bank line. */
  Optional<TransactionLink> findByExternalTransactionIdAndSupersededFalse(Long externalTransactionId);

  /** Find the live link for a financial record. */
  Optional<TransactionLink> findByFinancialRecordIdAndSupersededFalse(Long financialRecordId);

  long countByExternalTransactionIdAndSupersededFalse(Long externalTransactionId);

  /** All links (including superseded) for a bank line, for audit history. */
  List<TransactionLink> findByExternalTransactionIdOrderByCreatedAtDesc(Long externalTransactionId);
}
