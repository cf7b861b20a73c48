package com.slotbooking.booking.domain.repository;

import com.slotbooking.booking.domain.model.BlockedSlot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface BlockedSlotRepository extends JpaRepository<BlockedSlot, Long> {

    List<BlockedSlot> findByProviderIdAndBlockedDate(Long providerId, LocalDate date);

    List<BlockedSlot> findByProviderIdAndBlockedDateBetweenOrderByBlockedDateAsc(
            Long providerId, LocalDate from, LocalDate to);

    Optional<BlockedSlot> findByIdAndProviderId(Long id, Long providerId);
}
