package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.model.BookingStatus;

import java.util.Set;

public record InvalidTransitionResponse(
        BookingStatus currentStatus,
        BookingStatus requestedStatus,
        Set<BookingStatus> allowedStatuses
) {
}
