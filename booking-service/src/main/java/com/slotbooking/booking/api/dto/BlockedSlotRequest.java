package com.slotbooking.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Omit both times to block the whole day.
 */
public record BlockedSlotRequest(
        @NotNull(message = "Date cannot be null")
        LocalDate date,

        LocalTime startTime,

        LocalTime endTime,

        @Size(max = 255)
        String reason
) {
}
