package com.example.reconciliation.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.Booking;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

  Optional<Booking> findByReserveNumber(String reserveNumber);

  List<Booking> findByNeedsReviewTrue();

  /** Loads and row-locks the given bookings for the duration of the surrounding transaction. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT b FROM Booking b WHERE b.id IN :ids ORDER BY b.id")
  List<Booking> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);
}
