package com.example.reconciliation.repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.FinancialRecord;
import com.example.reconciliation.domain.FinancialRecord.RecordType;
import com.example.reconciliation.domain.ImportBatch;

@Repository
public interface FinancialRecordRepository extends JpaRepository<FinancialRecord, Long> {

  boolean existsByFingerprint(String fingerprint);

  List<FinancialRecord> findByImportBatch(ImportBatch importBatch);

  /** Records of any type dated within the range that are not yet linked to a bank line. */
  @Query(
      "SELECT r FROM FinancialRecord r "
          + "WHERE r.recordDate BETWEEN :fromDate AND :toDate "
          + "AND NOT EXISTS (SELECT l FROM TransactionLink l "
          + "  WHERE l.financialRecordId = r.id AND l.superseded = false) "
          + "ORDER BY r.recordDate ASC, r.id ASC")
  List<FinancialRecord> findUnlinkedByDateRange(
      @Param("fromDate") LocalDate fromDate, @Param("toDate") LocalDate toDate);

  // Total of records of one type referencing a booking, whether or not they are bank-linked.
  // Null when there are none.
  @Query(
      "SELECT SUM(r.amount) FROM FinancialRecord r "
          + "WHERE r.booking.id = :bookingId AND r.recordType = :type")
  BigDecimal sumByBookingAndType(
      @Param("bookingId") Long bookingId, @Param("type") RecordType type);
}
