package com.slotbooking.booking.exception;

import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.common.exception.BusinessException;
import lombok.Getter;

/**
 * Requested status change is not in the booking transition table.
 */
@Getter
public class InvalidTransitionException extends BusinessException {

    private final BookingStatus current;
    private final BookingStatus requested;

    public InvalidTransitionException(BookingStatus current, BookingStatus requested) {
        super(String.format("Cannot transition booking from %s to %s", current, requested), "INVALID_TRANSITION");
        this.current = current;
        this.requested = requested;
    }
}
