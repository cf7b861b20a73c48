package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.availability.TimeSlot;
import com.slotbooking.booking.domain.service.SlotLockResult;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record SlotLockResponse(
        boolean acquired,
        UUID lockId,
        LocalDateTime lockedUntil,
        List<TimeSlot> alternatives
) {
    public static SlotLockResponse from(SlotLockResult result) {
        return new SlotLockResponse(result.acquired(), result.lockId(), result.lockedUntil(), result.alternatives());
    }
}
