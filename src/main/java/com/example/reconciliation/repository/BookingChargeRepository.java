package com.example.reconciliation.repository;

import java.math.BigDecimal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.reconciliation.domain.BookingCharge;

@Repository
public interface BookingChargeRepository extends JpaRepository<BookingCharge, Long> {

  // Null when the booking has no charge lines at all
  @Query("SELECT SUM(c.amount) FROM BookingCharge c WHERE c.booking.id = :bookingId")
  BigDecimal sumByBookingId(@Param("bookingId") Long bookingId);
}
