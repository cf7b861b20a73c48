package com.slotbooking.payout.domain.repository;

import com.slotbooking.payout.domain.model.PayoutSchedule.PayoutStatus;

/** One row of a count grouped by payout status. */
public record PayoutStatusCount(PayoutStatus status, Long count) {}
