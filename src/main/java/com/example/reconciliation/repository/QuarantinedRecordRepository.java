package com.example.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.ImportBatch;
import com.example.reconciliation.domain.QuarantinedRecord;

@Repository
public interface QuarantinedRecordRepository extends JpaRepository<QuarantinedRecord, Long> {

  /** Open review queue, oldest first. */
  List<QuarantinedRecord> findByResolvedFalseOrderByCreatedAtAsc();

  List<QuarantinedRecord> findByImportBatch(ImportBatch importBatch);
}
