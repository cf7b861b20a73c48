package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

public record BookingResponse(
        Long id,
        Long providerId,
        Long customerId,
        String guestEmail,
        String guestName,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        BookingStatus status,
        BigDecimal totalAmount,
        BigDecimal guestSurcharge,
        BigDecimal platformFee,
        BigDecimal providerPayout,
        String confirmationCode,
        LocalDateTime cancelledAt,
        String cancelledBy,
        String cancellationReason,
        BigDecimal cancellationFee,
        LocalDateTime completedAt,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getProviderId(),
                booking.getCustomerId(),
                booking.getGuestEmail(),
                booking.getGuestName(),
                booking.getBookingDate(),
                booking.getStartTime(),
                booking.getEndTime(),
                booking.getStatus(),
                booking.getTotalAmount(),
                booking.getGuestSurcharge(),
                booking.getPlatformFee(),
                booking.getProviderPayout(),
                booking.getConfirmationCode(),
                booking.getCancelledAt(),
                booking.getCancelledBy(),
                booking.getCancellationReason(),
                booking.getCancellationFee(),
                booking.getCompletedAt(),
                booking.getCreatedAt()
        );
    }
}
