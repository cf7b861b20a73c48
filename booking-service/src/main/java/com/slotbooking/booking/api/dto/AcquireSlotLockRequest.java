package com.slotbooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalTime;

public record AcquireSlotLockRequest(
        @NotNull(message = "Provider ID cannot be null")
        Long providerId,

        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @NotNull(message = "Start time cannot be null")
        LocalTime startTime,

        @NotNull(message = "End time cannot be null")
        LocalTime endTime,

        @NotBlank(message = "Session ID cannot be blank")
        @Size(max = 128)
        String sessionId,

        @Positive(message = "TTL must be positive")
        Integer ttlMinutes
) {
}
