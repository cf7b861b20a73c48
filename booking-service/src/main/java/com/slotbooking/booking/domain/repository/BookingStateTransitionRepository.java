package com.slotbooking.booking.domain.repository;

import com.slotbooking.booking.domain.model.BookingStateTransition;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Insert and read only: the audit trail exposes no update or delete methods.
 */
public interface BookingStateTransitionRepository extends Repository<BookingStateTransition, Long> {

    BookingStateTransition save(BookingStateTransition transition);

    List<BookingStateTransition> findByBookingIdOrderByCreatedAtAscIdAsc(Long bookingId);

    long countByBookingId(Long bookingId);
}
