package com.example.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.ReconciliationRun;

@Repository
public interface ReconciliationRunRepository extends JpaRepository<ReconciliationRun, String> {

  List<ReconciliationRun> findTop20ByOrderByFinishedAtDesc();
}
