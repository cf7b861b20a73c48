package com.slotbooking.payout.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ManualCompletionRequest(
        @NotBlank @Size(max = 100) String externalTransactionId,
        @NotBlank @Size(max = 100) String operator,
        @Size(max = 500) String note
) {}
