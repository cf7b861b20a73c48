package com.slotbooking.booking.domain.service;

import java.math.BigDecimal;

public record ProviderBookingStats(
        long totalBookings,
        long completedBookings,
        long upcomingBookings,
        long cancelledBookings,
        BigDecimal totalRevenue,
        BigDecimal averageBookingValue
) {
}
