package com.slotbooking.payout.domain.repository;

import com.slotbooking.payout.domain.model.PayoutSchedule;
import com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Status changes are guarded updates. Each one states the status it expects to find and
 * returns the number of rows it changed, so a caller that lost a race sees 0.
 *
 * The guarded updates carry their own transaction and commit on return when called from
 * non-transactional code.
 */
public interface PayoutScheduleRepository extends JpaRepository<PayoutSchedule, Long> {

    Optional<PayoutSchedule> findByBookingId(Long bookingId);

    boolean existsByBookingId(Long bookingId);

    /** Ids of SCHEDULED payouts whose escrow has ended, oldest first. */
    @Query("""
           SELECT p.id FROM PayoutSchedule p
           WHERE p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.SCHEDULED
             AND p.scheduledAt <= :now
           ORDER BY p.scheduledAt ASC, p.id ASC
           """)
    List<Long> findDueIds(@Param("now") LocalDateTime now, Pageable pageable);

    /**
     * Flips SCHEDULED to PROCESSING. Returns 1 for the single worker that wins the payout,
     * 0 for everyone else.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PayoutSchedule p
           SET p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.PROCESSING,
               p.updatedAt = :now
           WHERE p.id = :id
             AND p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.SCHEDULED
           """)
    int claim(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PayoutSchedule p
           SET p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.COMPLETED,
               p.transferId = :transferId,
               p.processedAt = :now,
               p.failureReason = NULL,
               p.updatedAt = :now
           WHERE p.id = :id
             AND p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.PROCESSING
           """)
    int markCompleted(@Param("id") Long id,
                      @Param("transferId") String transferId,
                      @Param("now") LocalDateTime now);

    /** Returns a PROCESSING payout to SCHEDULED after a retryable failure. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PayoutSchedule p
           SET p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.SCHEDULED,
               p.scheduledAt = :nextAttemptAt,
               p.retryCount = :retryCount,
               p.failureReason = :reason,
               p.updatedAt = :now
           WHERE p.id = :id
             AND p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.PROCESSING
           """)
    int reschedule(@Param("id") Long id,
                   @Param("nextAttemptAt") LocalDateTime nextAttemptAt,
                   @Param("retryCount") int retryCount,
                   @Param("reason") String reason,
                   @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PayoutSchedule p
           SET p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.FAILED,
               p.failureReason = :reason,
               p.processedAt = :now,
               p.updatedAt = :now
           WHERE p.id = :id
             AND p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.PROCESSING
           """)
    int markFailed(@Param("id") Long id, @Param("reason") String reason, @Param("now") LocalDateTime now);

    /** Operator override: records an out-of-band transfer. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PayoutSchedule p
           SET p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.COMPLETED,
               p.transferId = :transferId,
               p.resolvedBy = :operator,
               p.resolutionNote = :note,
               p.processedAt = :now,
               p.updatedAt = :now
           WHERE p.id = :id
             AND p.status IN :fromStatuses
           """)
    int completeManually(@Param("id") Long id,
                         @Param("transferId") String transferId,
                         @Param("operator") String operator,
                         @Param("note") String note,
                         @Param("fromStatuses") Collection<PayoutStatus> fromStatuses,
                         @Param("now") LocalDateTime now);

    /** Operator retry of a FAILED payout: due immediately with a fresh retry budget. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PayoutSchedule p
           SET p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.SCHEDULED,
               p.scheduledAt = :now,
               p.retryCount = 0,
               p.processedAt = NULL,
               p.resolvedBy = :operator,
               p.updatedAt = :now
           WHERE p.id = :id
             AND p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.FAILED
           """)
    int requeueFailed(@Param("id") Long id, @Param("operator") String operator, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PayoutSchedule p
           SET p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.CANCELLED,
               p.failureReason = :reason,
               p.processedAt = :now,
               p.updatedAt = :now
           WHERE p.id = :id
             AND p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.SCHEDULED
           """)
    int cancel(@Param("id") Long id, @Param("reason") String reason, @Param("now") LocalDateTime now);

    /**
     * Returns payouts left in PROCESSING by a worker that died mid-transfer. The next pass
     * re-sends the same idempotency key.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PayoutSchedule p
           SET p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.SCHEDULED,
               p.scheduledAt = :now,
               p.updatedAt = :now
           WHERE p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.PROCESSING
             AND p.updatedAt < :threshold
           """)
    int resetStuck(@Param("threshold") LocalDateTime threshold, @Param("now") LocalDateTime now);

    Page<PayoutSchedule> findByProviderIdOrderByCreatedAtDescIdDesc(Long providerId, Pageable pageable);

    long countByProviderIdAndStatus(Long providerId, PayoutStatus status);

    @Query("""
           SELECT COALESCE(SUM(p.netPayout), 0) FROM PayoutSchedule p
           WHERE p.providerId = :providerId AND p.status IN :statuses
           """)
    BigDecimal sumNetPayout(@Param("providerId") Long providerId,
                            @Param("statuses") Collection<PayoutStatus> statuses);

    @Query("""
           SELECT MIN(p.scheduledAt) FROM PayoutSchedule p
           WHERE p.providerId = :providerId
             AND p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.SCHEDULED
           """)
    Optional<LocalDateTime> findNextScheduledAt(@Param("providerId") Long providerId);

    /** Payout counts per status among payouts created at or after {@code since}. */
    @Query("""
           SELECT new com.slotbooking.payout.domain.repository.PayoutStatusCount(p.status, COUNT(p))
           FROM PayoutSchedule p
           WHERE p.createdAt >= :since
           GROUP BY p.status
           """)
    List<PayoutStatusCount> countByStatusCreatedSince(@Param("since") LocalDateTime since);

    @Query("""
           SELECT MIN(p.scheduledAt) FROM PayoutSchedule p
           WHERE p.createdAt >= :since
             AND p.status = com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus.SCHEDULED
           """)
    Optional<LocalDateTime> findOldestScheduledAtCreatedSince(@Param("since") LocalDateTime since);
}
