package com.slotbooking.payout.client.dto;

public record TransferResponse(
        String id,
        long amount,
        String currency,
        String destination,
        String status
) {}
