package com.slotbooking.booking.domain.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Booking lifecycle. The transition table is exhaustive: anything not listed is illegal.
 */
public enum BookingStatus {
    PENDING,
    PAYMENT_FAILED,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW,
    REFUNDED;

    private static final Map<BookingStatus, Set<BookingStatus>> TRANSITIONS = Map.of(
            PENDING, EnumSet.of(PAYMENT_FAILED, CONFIRMED, CANCELLED),
            PAYMENT_FAILED, EnumSet.of(PENDING, CANCELLED),
            CONFIRMED, EnumSet.of(IN_PROGRESS, CANCELLED, NO_SHOW),
            IN_PROGRESS, EnumSet.of(COMPLETED, CANCELLED),
            COMPLETED, EnumSet.of(REFUNDED),
            CANCELLED, EnumSet.of(REFUNDED),
            NO_SHOW, EnumSet.of(REFUNDED),
            REFUNDED, EnumSet.noneOf(BookingStatus.class)
    );

    /** Statuses that no longer occupy their time range. */
    public static final Set<BookingStatus> SLOT_RELEASING = EnumSet.of(CANCELLED, REFUNDED);

    public boolean canTransitionTo(BookingStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<BookingStatus> allowedTargets() {
        return EnumSet.copyOf(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean occupiesSlot() {
        return !SLOT_RELEASING.contains(this);
    }
}
