package com.slotbooking.payout.domain.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Input for {@link PayoutService#schedulePayout}. {@code completedAt} is UTC; when null the
 * current time is used.
 */
public record SchedulePayoutCommand(
        Long bookingId,
        Long providerId,
        String payoutAccountId,
        BigDecimal amount,
        BigDecimal platformFee,
        LocalDateTime completedAt
) {}
