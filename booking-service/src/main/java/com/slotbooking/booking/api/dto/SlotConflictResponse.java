package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.availability.TimeSlot;

import java.util.List;

public record SlotConflictResponse(
        Long blockingBookingId,
        List<TimeSlot> alternatives
) {
}
