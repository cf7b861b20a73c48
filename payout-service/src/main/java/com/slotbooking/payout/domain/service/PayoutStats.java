package com.slotbooking.payout.domain.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PayoutStats(
        BigDecimal totalPaid,
        BigDecimal pendingAmount,
        long pendingPayouts,
        long completedPayouts,
        long failedPayouts,
        LocalDateTime nextPayoutAt
) {}
