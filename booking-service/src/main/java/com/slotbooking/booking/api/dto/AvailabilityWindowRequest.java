package com.slotbooking.booking.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalTime;

public record AvailabilityWindowRequest(
        @NotNull(message = "Day of week cannot be null")
        DayOfWeek dayOfWeek,

        @NotNull(message = "Start time cannot be null")
        LocalTime startTime,

        @NotNull(message = "End time cannot be null")
        LocalTime endTime,

        Boolean active
) {
}
