package com.slotbooking.common.util;

/**
 * Keys and topic names shared by the booking, payout and notification services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:provider:";
    public static final String CACHE_AVAILABILITY_PREFIX = "availability:";

    public static final String TOPIC_BOOKING_CONFIRMED = "booking-confirmed";
    public static final String TOPIC_BOOKING_CANCELLED = "booking-cancelled";
    public static final String TOPIC_BOOKING_COMPLETED = "booking-completed";
    public static final String TOPIC_BOOKING_REFUNDED = "booking-refunded";
    public static final String TOPIC_PAYOUT_COMPLETED = "payout-completed";
    public static final String TOPIC_PAYOUT_FAILED = "payout-failed";

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;
}
