package com.example.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.BackupSnapshot;

@Repository
public interface BackupSnapshotRepository extends JpaRepository<BackupSnapshot, Long> {

  List<BackupSnapshot> findByRunIdOrderByTableNameAscRowIdAsc(String runId);
}
