package com.slotbooking.payout.domain.service;

import java.time.LocalDateTime;

/**
 * System-wide payout health over a recent window of created payouts.
 *
 * @param oldestPending earliest scheduledAt among SCHEDULED payouts, null when there are none
 * @param failureRate   failed / (completed + failed), 0 when nothing has finished
 */
public record PayoutHealth(
        long pendingCount,
        long processingCount,
        long failedCount,
        LocalDateTime oldestPending,
        double failureRate
) {}
