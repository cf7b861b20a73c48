package com.slotbooking.payout.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when the provider's share has been transferred, automatically or by an operator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutCompletedEvent {
    private Long payoutId;
    private Long bookingId;
    private Long providerId;
    private BigDecimal netPayout;
    private String currency;
    private String transferId;
    private boolean manual;
    private Instant timestamp;
}
