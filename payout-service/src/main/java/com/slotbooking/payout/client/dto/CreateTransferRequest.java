package com.slotbooking.payout.client.dto;

import java.util.Map;

/**
 * Transfer payload. {@code amount} is in the currency's minor unit (cents).
 */
public record CreateTransferRequest(
        long amount,
        String currency,
        String destination,
        String transferGroup,
        Map<String, String> metadata
) {}
