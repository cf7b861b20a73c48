package com.slotbooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when a booking is refunded. payout-service cancels a payout that has not
 * started processing yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingRefundedEvent {
    private Long bookingId;
    private Long providerId;
    private String previousStatus;
    private BigDecimal totalAmount;
    private String reason;
    private Instant timestamp;
}
