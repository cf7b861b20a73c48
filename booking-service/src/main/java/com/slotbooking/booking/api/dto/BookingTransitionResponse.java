package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.model.BookingStateTransition;
import com.slotbooking.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

public record BookingTransitionResponse(
        BookingStatus fromStatus,
        BookingStatus toStatus,
        String triggeredBy,
        String reason,
        LocalDateTime createdAt
) {
    public static BookingTransitionResponse from(BookingStateTransition transition) {
        return new BookingTransitionResponse(
                transition.getFromStatus(),
                transition.getToStatus(),
                transition.getTriggeredBy(),
                transition.getReason(),
                transition.getCreatedAt()
        );
    }
}
