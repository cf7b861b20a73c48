package com.slotbooking.payout.domain.service;

public record PayoutBatchResult(int selected, int completed, int rescheduled, int failed, int skipped) {

    public static PayoutBatchResult empty() {
        return new PayoutBatchResult(0, 0, 0, 0, 0);
    }
}
