package com.slotbooking.booking.domain.repository;

import com.slotbooking.booking.domain.model.CancellationCharge;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CancellationChargeRepository extends JpaRepository<CancellationCharge, Long> {
    Optional<CancellationCharge> findByBookingId(Long bookingId);
}
