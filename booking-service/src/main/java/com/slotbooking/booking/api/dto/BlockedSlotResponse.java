package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.model.BlockedSlot;

import java.time.LocalDate;
import java.time.LocalTime;

public record BlockedSlotResponse(
        Long id,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        boolean fullDay,
        String reason
) {
    public static BlockedSlotResponse from(BlockedSlot block) {
        return new BlockedSlotResponse(
                block.getId(),
                block.getBlockedDate(),
                block.getStartTime(),
                block.getEndTime(),
                block.isFullDay(),
                block.getReason()
        );
    }
}
