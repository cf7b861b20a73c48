package com.slotbooking.booking.domain.repository;

import com.slotbooking.booking.domain.model.SlotLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SlotLockRepository extends JpaRepository<SlotLock, UUID> {

    /**
     * Claims the slot in a single statement. Inserts a new lock, takes over an expired one,
     * or refreshes the caller's own lock (keeping its id). A live lock held by another
     * session is left untouched.
     *
     * Returns the number of rows affected:
     * - 1: lock acquired
     * - 0: contested
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
           INSERT INTO slot_locks (id, provider_id, slot_date, start_time, end_time, session_id, locked_until, created_at)
           VALUES (:id, :providerId, :date, :start, :end, :sessionId, :lockedUntil, :now)
           ON CONFLICT (provider_id, slot_date, start_time, end_time) DO UPDATE
           SET id = CASE WHEN slot_locks.session_id = EXCLUDED.session_id THEN slot_locks.id ELSE EXCLUDED.id END,
               session_id = EXCLUDED.session_id,
               locked_until = EXCLUDED.locked_until,
               created_at = EXCLUDED.created_at
           WHERE slot_locks.locked_until <= :now
              OR slot_locks.session_id = EXCLUDED.session_id
           """, nativeQuery = true)
    int tryAcquire(@Param("id") UUID id,
                   @Param("providerId") Long providerId,
                   @Param("date") LocalDate date,
                   @Param("start") LocalTime start,
                   @Param("end") LocalTime end,
                   @Param("sessionId") String sessionId,
                   @Param("lockedUntil") LocalDateTime lockedUntil,
                   @Param("now") LocalDateTime now);

    Optional<SlotLock> findByProviderIdAndSlotDateAndStartTimeAndEndTime(
            Long providerId, LocalDate date, LocalTime start, LocalTime end);

    /** Unexpired locks of other sessions on ranges overlapping [start, end). */
    @Query("""
           SELECT l FROM SlotLock l
           WHERE l.providerId = :providerId
             AND l.slotDate = :date
             AND l.startTime < :end
             AND l.endTime > :start
             AND l.lockedUntil > :now
             AND l.sessionId <> :sessionId
           """)
    List<SlotLock> findActiveOverlappingHeldByOthers(@Param("providerId") Long providerId,
                                                     @Param("date") LocalDate date,
                                                     @Param("start") LocalTime start,
                                                     @Param("end") LocalTime end,
                                                     @Param("sessionId") String sessionId,
                                                     @Param("now") LocalDateTime now);

    @Query("""
           SELECT l FROM SlotLock l
           WHERE l.providerId = :providerId
             AND l.slotDate BETWEEN :from AND :to
             AND l.lockedUntil > :now
           """)
    List<SlotLock> findActive(@Param("providerId") Long providerId,
                              @Param("from") LocalDate from,
                              @Param("to") LocalDate to,
                              @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SlotLock l WHERE l.id = :id")
    int deleteLock(@Param("id") UUID id);

    @Query("SELECT l FROM SlotLock l WHERE l.lockedUntil <= :now")
    List<SlotLock> findExpired(@Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SlotLock l WHERE l.lockedUntil <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
