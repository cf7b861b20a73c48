package com.slotbooking.payout.api.dto;

import com.slotbooking.payout.domain.model.PayoutSchedule;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PayoutResponse(
        Long id,
        Long bookingId,
        Long providerId,
        BigDecimal amount,
        BigDecimal platformFee,
        BigDecimal netPayout,
        String currency,
        String status,
        LocalDateTime scheduledAt,
        LocalDateTime processedAt,
        int retryCount,
        String failureReason,
        String transferId,
        String resolvedBy,
        String resolutionNote,
        LocalDateTime createdAt
) {
    public static PayoutResponse from(PayoutSchedule payout) {
        return new PayoutResponse(
                payout.getId(),
                payout.getBookingId(),
                payout.getProviderId(),
                payout.getAmount(),
                payout.getPlatformFee(),
                payout.getNetPayout(),
                payout.getCurrency(),
                payout.getStatus().name(),
                payout.getScheduledAt(),
                payout.getProcessedAt(),
                payout.getRetryCount(),
                payout.getFailureReason(),
                payout.getTransferId(),
                payout.getResolvedBy(),
                payout.getResolutionNote(),
                payout.getCreatedAt()
        );
    }
}
