package com.slotbooking.booking.domain.availability;

import java.util.List;

/**
 * Availability of one provider over a date range. Slot dates and times are wall-clock in
 * {@code providerTimezone}; {@code requestedTimezone} is the caller's zone, echoed back
 * for display.
 */
public record ProviderAvailability(Long providerId,
                                   String providerTimezone,
                                   String requestedTimezone,
                                   List<DayAvailability> days) {
}
