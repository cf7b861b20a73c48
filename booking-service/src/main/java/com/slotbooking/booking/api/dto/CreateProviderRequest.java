package com.slotbooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateProviderRequest(
        @NotBlank(message = "Display name cannot be blank")
        @Size(max = 200)
        String displayName,

        String timezone,

        @Size(max = 100)
        String payoutAccountId
) {
}
