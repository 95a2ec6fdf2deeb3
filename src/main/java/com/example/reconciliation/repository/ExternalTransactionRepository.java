package com.example.reconciliation.repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.ExternalTransaction;
import com.example.reconciliation.domain.ImportBatch;

@Repository
public interface ExternalTransactionRepository extends JpaRepository<ExternalTransaction, Long> {

  boolean existsByFingerprint(String fingerprint);

  List<ExternalTransaction> findByImportBatch(ImportBatch importBatch);

  /**
   * Bank lines in the date range that have neither a live link nor a reversal pairing, oldest
   * first. A null source account covers every account.
   */
  @Query(
      "SELECT t FROM ExternalTransaction t "
          + "WHERE (:sourceAccount IS NULL OR t.sourceAccount = :sourceAccount) "
          + "AND t.transactionDate BETWEEN :fromDate AND :toDate "
          + "AND NOT EXISTS (SELECT l FROM TransactionLink l "
          + "  WHERE l.externalTransactionId = t.id AND l.superseded = false) "
          + "AND NOT EXISTS (SELECT p FROM ReversalPair p "
          + "  WHERE p.originalTransactionId = t.id OR p.reversingTransactionId = t.id) "
          + "ORDER BY t.transactionDate ASC, t.id ASC")
  List<ExternalTransaction> findUnreconciled(
      @Param("sourceAccount") String sourceAccount,
      @Param("fromDate") LocalDate fromDate,
      @Param("toDate") LocalDate toDate);

  /** Loads and row-locks the given bank lines for the duration of the surrounding transaction. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM ExternalTransaction t WHERE t.id IN :ids ORDER BY t.id")
  List<ExternalTransaction> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);
}
