package com.slotbooking.payout.domain.service;

import com.slotbooking.payout.client.PaymentProviderGateway;
import com.slotbooking.payout.client.dto.TransferResponse;
import com.slotbooking.payout.domain.model.PayoutSchedule;
import com.slotbooking.payout.domain.repository.PayoutScheduleRepository;
import com.slotbooking.payout.domain.retry.RetryPolicy;
import com.slotbooking.payout.events.PayoutEventPublisher;
import com.slotbooking.payout.exception.PermanentProviderException;
import com.slotbooking.payout.exception.TransientProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Moves due payouts through claim, transfer and outcome.
 *
 * Not transactional: the claim commits before the provider is called, so a concurrent
 * worker sees PROCESSING and skips the row. Each outcome is written by its own guarded
 * update.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayoutProcessor {

    private static final int MAX_REASON_LENGTH = 500;

    private final PayoutScheduleRepository payoutRepository;
    private final PaymentProviderGateway paymentProviderGateway;
    private final RetryPolicy retryPolicy;
    private final PayoutEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${payout.batch-size:50}")
    private int batchSize;

    public PayoutBatchResult processDuePayouts() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> dueIds = payoutRepository.findDueIds(now, PageRequest.of(0, batchSize));
        if (dueIds.isEmpty()) {
            return PayoutBatchResult.empty();
        }
        log.info("Payout batch: {} due payout(s)", dueIds.size());

        int completed = 0, rescheduled = 0, failed = 0, skipped = 0;
        for (Long id : dueIds) {
            try {
                switch (processPayout(id)) {
                    case COMPLETED -> completed++;
                    case RESCHEDULED -> rescheduled++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                }
            } catch (Exception e) {
                log.error("Processing failed for payout {}", id, e);
                skipped++;
            }
        }
        PayoutBatchResult result = new PayoutBatchResult(dueIds.size(), completed, rescheduled, failed, skipped);
        log.info("Payout batch finished: {}", result);
        return result;
    }

    public PayoutOutcome processPayout(Long payoutId) {
        if (payoutRepository.claim(payoutId, LocalDateTime.now(clock)) == 0) {
            log.debug("Payout {} already claimed or no longer scheduled", payoutId);
            return PayoutOutcome.SKIPPED;
        }
        PayoutSchedule payout = payoutRepository.findById(payoutId)
                .orElseThrow(() -> new IllegalStateException("Claimed payout " + payoutId + " vanished"));

        try {
            TransferResponse transfer = paymentProviderGateway.transfer(payout);
            return onTransferSucceeded(payout, transfer);
        } catch (TransientProviderException e) {
            return onTransientFailure(payout, e);
        } catch (PermanentProviderException e) {
            return onPermanentFailure(payout, e);
        }
    }

    private PayoutOutcome onTransferSucceeded(PayoutSchedule payout, TransferResponse transfer) {
        int updated = payoutRepository.markCompleted(payout.getId(), transfer.id(), LocalDateTime.now(clock));
        if (updated == 0) {
            // Recovery reset the row mid-transfer; the next pass resends the same key.
            log.warn("Payout {} transferred as {} but was no longer PROCESSING", payout.getId(), transfer.id());
            return PayoutOutcome.SKIPPED;
        }
        log.info("Payout {} completed: booking {}, transfer {}, {} {}", payout.getId(), payout.getBookingId(),
                transfer.id(), payout.getNetPayout(), payout.getCurrency());
        eventPublisher.publishPayoutCompleted(payout, transfer.id(), false);
        return PayoutOutcome.COMPLETED;
    }

    private PayoutOutcome onTransientFailure(PayoutSchedule payout, TransientProviderException e) {
        LocalDateTime now = LocalDateTime.now(clock);
        int retriesSoFar = payout.getRetryCount();
        if (retryPolicy.canRetry(retriesSoFar)) {
            int attempt = retriesSoFar + 1;
            Duration delay = retryPolicy.delayFor(attempt);
            LocalDateTime nextAttemptAt = now.plus(delay);
            payoutRepository.reschedule(payout.getId(), nextAttemptAt, attempt, truncate(e.getMessage()), now);
            log.warn("Payout {} transient failure, retry {}/{} at {}: {}", payout.getId(), attempt,
                    retryPolicy.maxRetries(), nextAttemptAt, e.getMessage());
            return PayoutOutcome.RESCHEDULED;
        }

        String reason = truncate(e.getMessage() + " (max retries exceeded)");
        fail(payout, reason, false, now);
        return PayoutOutcome.FAILED;
    }

    private PayoutOutcome onPermanentFailure(PayoutSchedule payout, PermanentProviderException e) {
        fail(payout, truncate(e.getMessage()), true, LocalDateTime.now(clock));
        return PayoutOutcome.FAILED;
    }

    private void fail(PayoutSchedule payout, String reason, boolean permanent, LocalDateTime now) {
        if (payoutRepository.markFailed(payout.getId(), reason, now) == 0) {
            log.warn("Payout {} could not be marked FAILED; it was no longer PROCESSING", payout.getId());
            return;
        }
        log.error("ALERT payout {} FAILED for booking {} after {} retries (permanent={}): {}",
                payout.getId(), payout.getBookingId(), payout.getRetryCount(), permanent, reason);
        eventPublisher.publishPayoutFailed(payout, payout.getRetryCount(), permanent, reason);
    }

    private static String truncate(String reason) {
        if (reason == null) return null;
        return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
    }
}
