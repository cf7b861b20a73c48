package com.slotbooking.payout.domain.service;

import com.slotbooking.common.exception.ConflictException;
import com.slotbooking.common.exception.ResourceNotFoundException;
import com.slotbooking.common.exception.ValidationException;
import com.slotbooking.common.util.Constants;
import com.slotbooking.payout.domain.model.PayoutSchedule;
import com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus;
import com.slotbooking.payout.domain.repository.PayoutScheduleRepository;
import com.slotbooking.payout.domain.repository.PayoutStatusCount;
import com.slotbooking.payout.events.PayoutEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates payout schedules and serves operator actions and provider earnings queries.
 * Automatic processing lives in {@link PayoutProcessor}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutService {

    private static final List<PayoutStatus> MANUAL_COMPLETION_FROM = List.of(PayoutStatus.FAILED, PayoutStatus.SCHEDULED);
    private static final List<PayoutStatus> PENDING_STATUSES = List.of(PayoutStatus.SCHEDULED, PayoutStatus.PROCESSING);

    private final PayoutScheduleRepository payoutRepository;
    private final PayoutEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${payout.escrow-days:7}")
    private int escrowDays;

    @Value("${payout.min-amount:1.00}")
    private BigDecimal minAmount;

    @Value("${payout.currency:usd}")
    private String currency;

    @Value("${payout.health.window-days:7}")
    private int healthWindowDays;

    /**
     * Schedules the provider's share of a completed booking for release after the escrow window.
     *
     * @throws ValidationException below minimum amount, missing payout account or malformed amounts
     * @throws ConflictException a payout already exists for the booking
     */
    @Transactional
    public PayoutSchedule schedulePayout(SchedulePayoutCommand command) {
        validate(command);

        BigDecimal amount = command.amount().setScale(2, RoundingMode.HALF_UP);
        BigDecimal platformFee = command.platformFee().setScale(2, RoundingMode.HALF_UP);
        BigDecimal netPayout = amount.subtract(platformFee);
        if (netPayout.compareTo(minAmount) < 0) {
            log.warn("Payout for booking {} below minimum: {} < {}", command.bookingId(), netPayout, minAmount);
            throw new ValidationException(
                    "Net payout " + netPayout + " is below the minimum of " + minAmount, "PAYOUT_BELOW_MINIMUM");
        }
        if (payoutRepository.existsByBookingId(command.bookingId())) {
            throw duplicate(command.bookingId(), null);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime completedAt = command.completedAt() != null ? command.completedAt() : now;
        PayoutSchedule payout = PayoutSchedule.builder()
                .bookingId(command.bookingId())
                .providerId(command.providerId())
                .payoutAccountId(command.payoutAccountId())
                .amount(amount)
                .platformFee(platformFee)
                .netPayout(netPayout)
                .currency(currency)
                .status(PayoutStatus.SCHEDULED)
                .scheduledAt(completedAt.plusDays(escrowDays))
                .retryCount(0)
                .createdAt(now)
                .build();

        try {
            payout = payoutRepository.saveAndFlush(payout);
        } catch (DataIntegrityViolationException e) {
            throw duplicate(command.bookingId(), e);
        }
        log.info("Payout {} scheduled for booking {}: {} {} at {}", payout.getId(), payout.getBookingId(),
                netPayout, currency, payout.getScheduledAt());
        return payout;
    }

    /**
     * Records a transfer made outside the engine. Allowed from FAILED and SCHEDULED.
     */
    public PayoutSchedule completeManually(Long payoutId, String externalTransactionId, String operator, String note) {
        if (externalTransactionId == null || externalTransactionId.isBlank()) {
            throw new ValidationException("External transaction id is required");
        }
        if (operator == null || operator.isBlank()) {
            throw new ValidationException("Operator is required");
        }
        int updated = payoutRepository.completeManually(payoutId, externalTransactionId, operator, note,
                MANUAL_COMPLETION_FROM, LocalDateTime.now(clock));
        PayoutSchedule payout = getPayout(payoutId);
        if (updated == 0) {
            throw new ConflictException("Payout " + payoutId + " is " + payout.getStatus()
                    + "; manual completion requires FAILED or SCHEDULED", "INVALID_PAYOUT_STATE");
        }
        log.info("Payout {} completed manually by {} with transaction {}", payoutId, operator, externalTransactionId);
        eventPublisher.publishPayoutCompleted(payout, externalTransactionId, true);
        return payout;
    }

    /**
     * Puts a FAILED payout back in the queue, due now, with its retry budget reset.
     */
    public PayoutSchedule retryPayout(Long payoutId, String operator) {
        int updated = payoutRepository.requeueFailed(payoutId, operator, LocalDateTime.now(clock));
        PayoutSchedule payout = getPayout(payoutId);
        if (updated == 0) {
            throw new ConflictException("Payout " + payoutId + " is " + payout.getStatus()
                    + "; only FAILED payouts can be retried", "INVALID_PAYOUT_STATE");
        }
        log.info("Payout {} requeued by {}", payoutId, operator);
        return payout;
    }

    public PayoutSchedule cancelPayout(Long payoutId, String reason) {
        int updated = payoutRepository.cancel(payoutId, reason, LocalDateTime.now(clock));
        PayoutSchedule payout = getPayout(payoutId);
        if (updated == 0) {
            throw new ConflictException("Payout " + payoutId + " is " + payout.getStatus()
                    + "; only SCHEDULED payouts can be cancelled", "INVALID_PAYOUT_STATE");
        }
        log.info("Payout {} cancelled: {}", payoutId, reason);
        return payout;
    }

    /**
     * Refund path. A payout that already started or finished is left alone and flagged
     * for reconciliation.
     */
    public void cancelForBooking(Long bookingId, String reason) {
        Optional<PayoutSchedule> existing = payoutRepository.findByBookingId(bookingId);
        if (existing.isEmpty()) {
            log.info("No payout to cancel for refunded booking {}", bookingId);
            return;
        }
        PayoutSchedule payout = existing.get();
        String cancelReason = "Booking refunded" + (reason != null && !reason.isBlank() ? ": " + reason : "");
        if (payoutRepository.cancel(payout.getId(), cancelReason, LocalDateTime.now(clock)) == 1) {
            log.info("Payout {} cancelled after refund of booking {}", payout.getId(), bookingId);
            return;
        }
        PayoutSchedule current = getPayout(payout.getId());
        if (current.getStatus() != PayoutStatus.CANCELLED) {
            log.warn("Booking {} refunded but payout {} is {}; manual reconciliation required",
                    bookingId, current.getId(), current.getStatus());
        }
    }

    public PayoutSchedule getPayout(Long payoutId) {
        return payoutRepository.findById(payoutId)
                .orElseThrow(() -> new ResourceNotFoundException("Payout", payoutId));
    }

    public PayoutSchedule getBookingPayout(Long bookingId) {
        return payoutRepository.findByBookingId(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Payout for booking", bookingId));
    }

    public Page<PayoutSchedule> getProviderPayoutHistory(Long providerId, int page, int size) {
        if (page < 0) {
            throw new ValidationException("page must not be negative");
        }
        int pageSize = size <= 0 ? Constants.DEFAULT_PAGE_SIZE : Math.min(size, Constants.MAX_PAGE_SIZE);
        return payoutRepository.findByProviderIdOrderByCreatedAtDescIdDesc(providerId, PageRequest.of(page, pageSize));
    }

    @Transactional(readOnly = true)
    public PayoutStats getProviderStats(Long providerId) {
        BigDecimal totalPaid = payoutRepository.sumNetPayout(providerId, List.of(PayoutStatus.COMPLETED));
        BigDecimal pendingAmount = payoutRepository.sumNetPayout(providerId, PENDING_STATUSES);
        long pending = payoutRepository.countByProviderIdAndStatus(providerId, PayoutStatus.SCHEDULED)
                + payoutRepository.countByProviderIdAndStatus(providerId, PayoutStatus.PROCESSING);
        long completed = payoutRepository.countByProviderIdAndStatus(providerId, PayoutStatus.COMPLETED);
        long failed = payoutRepository.countByProviderIdAndStatus(providerId, PayoutStatus.FAILED);
        LocalDateTime next = payoutRepository.findNextScheduledAt(providerId).orElse(null);
        return new PayoutStats(totalPaid, pendingAmount, pending, completed, failed, next);
    }

    /**
     * Counts and failure rate over payouts created in the last {@code payout.health.window-days}.
     */
    @Transactional(readOnly = true)
    public PayoutHealth getSystemPayoutHealth() {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(healthWindowDays);
        Map<PayoutStatus, Long> counts = new EnumMap<>(PayoutStatus.class);
        for (PayoutStatusCount row : payoutRepository.countByStatusCreatedSince(since)) {
            counts.put(row.status(), row.count());
        }
        long completed = counts.getOrDefault(PayoutStatus.COMPLETED, 0L);
        long failed = counts.getOrDefault(PayoutStatus.FAILED, 0L);
        double failureRate = completed + failed > 0 ? (double) failed / (completed + failed) : 0.0;

        PayoutHealth health = new PayoutHealth(
                counts.getOrDefault(PayoutStatus.SCHEDULED, 0L),
                counts.getOrDefault(PayoutStatus.PROCESSING, 0L),
                failed,
                payoutRepository.findOldestScheduledAtCreatedSince(since).orElse(null),
                failureRate);
        if (failed > 0) {
            log.warn("Payout health since {}: {} failed, failure rate {}", since, failed, failureRate);
        }
        return health;
    }

    private void validate(SchedulePayoutCommand command) {
        if (command.bookingId() == null || command.providerId() == null) {
            throw new ValidationException("bookingId and providerId are required");
        }
        if (command.payoutAccountId() == null || command.payoutAccountId().isBlank()) {
            log.warn("Provider {} has no payout account; booking {} not scheduled",
                    command.providerId(), command.bookingId());
            throw new ValidationException("Provider " + command.providerId() + " has no payout account",
                    "PAYOUT_ACCOUNT_MISSING");
        }
        if (command.amount() == null || command.platformFee() == null
                || command.amount().signum() < 0 || command.platformFee().signum() < 0) {
            throw new ValidationException("amount and platformFee must be present and not negative");
        }
    }

    private ConflictException duplicate(Long bookingId, Throwable cause) {
        String message = "Payout already scheduled for booking " + bookingId;
        return cause != null
                ? new ConflictException(message, cause, "PAYOUT_ALREADY_SCHEDULED")
                : new ConflictException(message, "PAYOUT_ALREADY_SCHEDULED");
    }
}
