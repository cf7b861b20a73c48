package com.slotbooking.payout.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Manual scheduling for a completed booking whose event was lost. {@code completedAt} is UTC.
 */
public record SchedulePayoutRequest(
        @NotNull Long bookingId,
        @NotNull Long providerId,
        @NotBlank String payoutAccountId,
        @NotNull @DecimalMin("0.00") BigDecimal amount,
        @NotNull @DecimalMin("0.00") BigDecimal platformFee,
        LocalDateTime completedAt
) {}
