package com.slotbooking.booking.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Optional body of the named transition endpoints (confirm, cancel, ...).
 */
public record BookingActionRequest(
        @Size(max = 100)
        String triggeredBy,

        @Size(max = 500)
        String reason
) {
    public static final String DEFAULT_ACTOR = "api";

    public String actor() {
        return triggeredBy == null || triggeredBy.isBlank() ? DEFAULT_ACTOR : triggeredBy;
    }
}
