package com.slotbooking.booking.domain.availability;

import java.time.LocalDate;
import java.util.List;

public record DayAvailability(LocalDate date, List<TimeSlot> slots) {
}
