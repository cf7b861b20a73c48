package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.availability.TimeSlot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a lock attempt. Contention is a normal result, not an error: a contested
 * result carries alternative slots to offer instead.
 */
public record SlotLockResult(
        boolean acquired,
        UUID lockId,
        LocalDateTime lockedUntil,
        List<TimeSlot> alternatives
) {

    public static SlotLockResult acquired(UUID lockId, LocalDateTime lockedUntil) {
        return new SlotLockResult(true, lockId, lockedUntil, List.of());
    }

    public static SlotLockResult contested(List<TimeSlot> alternatives) {
        return new SlotLockResult(false, null, null, List.copyOf(alternatives));
    }
}
