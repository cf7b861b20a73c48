package com.slotbooking.booking.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

public record CreateBookingRequest(
        @NotNull(message = "Provider ID cannot be null")
        Long providerId,

        Long customerId,

        @Email(message = "Guest email must be a valid address")
        String guestEmail,

        String guestName,

        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @NotNull(message = "Start time cannot be null")
        LocalTime startTime,

        @NotNull(message = "End time cannot be null")
        LocalTime endTime,

        @NotNull(message = "Service price cannot be null")
        @Positive(message = "Service price must be positive")
        BigDecimal servicePrice,

        BigDecimal platformFee,

        BigDecimal providerPayout,

        @Pattern(regexp = "[A-Z0-9]{6,12}", message = "Confirmation code must be 6-12 characters A-Z0-9")
        String confirmationCode,

        UUID lockId
) {
}
