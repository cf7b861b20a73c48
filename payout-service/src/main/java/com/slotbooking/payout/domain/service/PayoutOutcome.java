package com.slotbooking.payout.domain.service;

/**
 * Result of one processing attempt on a single payout.
 */
public enum PayoutOutcome {
    /** Another worker claimed it first, or it was no longer SCHEDULED. */
    SKIPPED,
    COMPLETED,
    RESCHEDULED,
    FAILED
}
