package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.model.AvailabilityWindow;

import java.time.DayOfWeek;
import java.time.LocalTime;

public record AvailabilityWindowResponse(
        Long id,
        DayOfWeek dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        boolean active
) {
    public static AvailabilityWindowResponse from(AvailabilityWindow window) {
        return new AvailabilityWindowResponse(
                window.getId(),
                window.getDayOfWeek(),
                window.getStartTime(),
                window.getEndTime(),
                window.isActive()
        );
    }
}
