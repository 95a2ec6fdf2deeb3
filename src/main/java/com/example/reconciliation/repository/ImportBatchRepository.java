package com.example.reconciliation.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.ImportBatch;

@Repository
public interface ImportBatchRepository extends JpaRepository<ImportBatch, Long> {}
