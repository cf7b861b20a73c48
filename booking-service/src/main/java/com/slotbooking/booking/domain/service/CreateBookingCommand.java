package com.slotbooking.booking.domain.service;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Input of {@link BookingCoordinator#createBooking}. Either {@code customerId} or
 * {@code guestEmail} identifies the party; {@code lockId} is released after commit.
 * {@code servicePrice} excludes the guest surcharge.
 */
@Builder
public record CreateBookingCommand(
        Long providerId,
        Long customerId,
        String guestEmail,
        String guestName,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        BigDecimal servicePrice,
        BigDecimal platformFee,
        BigDecimal providerPayout,
        String confirmationCode,
        UUID lockId
) {

    /** A booking without a customer account; guests pay the surcharge. */
    public boolean isGuest() {
        return customerId == null && guestEmail != null && !guestEmail.isBlank();
    }
}
