package com.slotbooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Published when a booking is cancelled. A non-zero {@code cancellationFee} means a
 * cancellation charge was recorded. Consumed by notification-service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCancelledEvent {
    private Long bookingId;
    private Long providerId;
    private Long customerId;
    private String guestEmail;
    private String confirmationCode;
    private LocalDate bookingDate;
    private LocalTime startTime;
    private String previousStatus;
    private String cancelledBy;
    private String reason;
    private BigDecimal cancellationFee;
    private Instant timestamp;
}
