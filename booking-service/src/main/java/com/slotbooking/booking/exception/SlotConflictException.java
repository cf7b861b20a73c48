package com.slotbooking.booking.exception;

import com.slotbooking.booking.domain.availability.TimeSlot;
import com.slotbooking.common.exception.ConflictException;
import lombok.Getter;

import java.util.List;

/**
 * The requested range overlaps a booking that still occupies it.
 * {@code blockingBookingId} is null when the overlap was caught by the database
 * exclusion constraint rather than by the read-before-write check.
 */
@Getter
public class SlotConflictException extends ConflictException {

    private final Long blockingBookingId;
    private final List<TimeSlot> alternatives;

    public SlotConflictException(Long blockingBookingId, String message) {
        this(blockingBookingId, message, null, List.of());
    }

    public SlotConflictException(Long blockingBookingId, String message, Throwable cause) {
        this(blockingBookingId, message, cause, List.of());
    }

    private SlotConflictException(Long blockingBookingId, String message, Throwable cause, List<TimeSlot> alternatives) {
        super(message, cause, "SLOT_CONFLICT");
        this.blockingBookingId = blockingBookingId;
        this.alternatives = alternatives;
    }

    public SlotConflictException withAlternatives(List<TimeSlot> alternatives) {
        return new SlotConflictException(blockingBookingId, getMessage(), getCause(), List.copyOf(alternatives));
    }
}
