package com.slotbooking.booking.domain.availability;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Derived candidate interval. {@code available} reflects windows, blocks and bookings;
 * {@code lockedUntil} is the expiry of an advisory checkout lock, if any (UTC).
 */
public record TimeSlot(
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        boolean available,
        LocalDateTime lockedUntil
) {

    /** Free iff available and not under an unexpired lock. */
    public boolean isFree(LocalDateTime now) {
        return available && (lockedUntil == null || !lockedUntil.isAfter(now));
    }

    @JsonIgnore
    public TimeRange range() {
        return new TimeRange(startTime, endTime);
    }

    public TimeSlot withLockedUntil(LocalDateTime until) {
        return new TimeSlot(date, startTime, endTime, available, until);
    }

    public TimeSlot unavailable() {
        return new TimeSlot(date, startTime, endTime, false, lockedUntil);
    }
}
