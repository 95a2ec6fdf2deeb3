package com.example.reconciliation.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.ReversalPair;

@Repository
public interface ReversalPairRepository extends JpaRepository<ReversalPair, Long> {

  @Query(
      "SELECT p FROM ReversalPair p "
          + "WHERE p.originalTransactionId = :txId OR p.reversingTransactionId = :txId")
  Optional<ReversalPair> findByTransactionId(@Param("txId") Long transactionId);
}
