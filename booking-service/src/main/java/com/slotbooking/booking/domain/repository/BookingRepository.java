package com.slotbooking.booking.domain.repository;

import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    Optional<Booking> findByConfirmationCode(String confirmationCode);

    boolean existsByConfirmationCode(String confirmationCode);

    List<Booking> findByCustomerIdOrderByBookingDateDescStartTimeDesc(Long customerId);

    /**
     * Bookings still occupying time on the given date, with any of three overlap shapes
     * against [start, end): the new range starts inside an existing one, ends inside one,
     * or fully contains one.
     */
    @Query("""
           SELECT b FROM Booking b
           WHERE b.providerId = :providerId
             AND b.bookingDate = :date
             AND b.status NOT IN :released
             AND ((b.startTime <= :start AND b.endTime > :start)
               OR (b.startTime < :end AND b.endTime >= :end)
               OR (b.startTime >= :start AND b.endTime <= :end))
           ORDER BY b.startTime
           """)
    List<Booking> findConflicting(@Param("providerId") Long providerId,
                                  @Param("date") LocalDate date,
                                  @Param("start") LocalTime start,
                                  @Param("end") LocalTime end,
                                  @Param("released") Collection<BookingStatus> released);

    @Query("""
           SELECT b FROM Booking b
           WHERE b.providerId = :providerId
             AND b.bookingDate BETWEEN :from AND :to
             AND b.status NOT IN :released
           """)
    List<Booking> findOccupying(@Param("providerId") Long providerId,
                                @Param("from") LocalDate from,
                                @Param("to") LocalDate to,
                                @Param("released") Collection<BookingStatus> released);

    @Query("""
           SELECT b FROM Booking b
           WHERE b.providerId = :providerId
             AND b.bookingDate >= :from
             AND b.status IN :statuses
           ORDER BY b.bookingDate ASC, b.startTime ASC
           """)
    List<Booking> findUpcoming(@Param("providerId") Long providerId,
                               @Param("from") LocalDate from,
                               @Param("statuses") Collection<BookingStatus> statuses,
                               Pageable pageable);

    List<Booking> findByProviderIdAndBookingDateBetween(Long providerId, LocalDate from, LocalDate to);

    /**
     * Bookings in one of {@code statuses} whose end, read in the provider's zone, is at or
     * before {@code dueBeforeUtc}. Oldest first, so bookings not yet due never fill the batch.
     */
    @Query(value = """
           SELECT b.* FROM bookings b
           JOIN providers p ON p.id = b.provider_id
           WHERE b.status IN (:statuses)
             AND ((b.booking_date + b.end_time) AT TIME ZONE p.timezone)
                 <= (CAST(:dueBeforeUtc AS TIMESTAMP) AT TIME ZONE 'UTC')
           ORDER BY b.booking_date, b.end_time, b.id
           LIMIT :limit
           """, nativeQuery = true)
    List<Booking> findDueForCompletion(@Param("statuses") Collection<String> statuses,
                                       @Param("dueBeforeUtc") LocalDateTime dueBeforeUtc,
                                       @Param("limit") int limit);
}
