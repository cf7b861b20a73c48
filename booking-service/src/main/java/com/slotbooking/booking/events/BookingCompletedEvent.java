package com.slotbooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Published when a booking reaches COMPLETED; makes it eligible for a payout.
 * Consumed by payout-service and notification-service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCompletedEvent {
    private Long bookingId;
    private Long providerId;
    private Long customerId;
    private String guestEmail;
    private String payoutAccountId;
    private BigDecimal totalAmount;
    private BigDecimal platformFee;
    private BigDecimal providerPayout;
    /** UTC. */
    private LocalDateTime completedAt;
    private Instant timestamp;
}
