package com.slotbooking.payout.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Operator alert: the payout is terminally FAILED and needs manual action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutFailedEvent {
    private Long payoutId;
    private Long bookingId;
    private Long providerId;
    private BigDecimal netPayout;
    private String currency;
    private int retryCount;
    private boolean permanent;
    private String failureReason;
    private Instant timestamp;
}
