package com.slotbooking.payout.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payload of {@code booking-completed} as read by this service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BookingCompletedEvent {
    private Long bookingId;
    private Long providerId;
    private String payoutAccountId;
    private BigDecimal totalAmount;
    private BigDecimal platformFee;
    private BigDecimal providerPayout;
    private LocalDateTime completedAt;
}
