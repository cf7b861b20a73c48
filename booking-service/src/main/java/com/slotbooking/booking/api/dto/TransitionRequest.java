package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.model.BookingStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record TransitionRequest(
        @NotNull(message = "Target status cannot be null")
        BookingStatus status,

        @NotBlank(message = "triggeredBy cannot be blank")
        @Size(max = 100)
        String triggeredBy,

        @Size(max = 500)
        String reason
) {
}
