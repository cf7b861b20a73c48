package com.slotbooking.booking.domain.availability;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Expands windows into fixed-length slots for a single date.
 *
 * <ul>
 *   <li>slots start at the window start and advance by the slot duration;</li>
 *   <li>a trailing remainder shorter than the duration is dropped, not truncated;</li>
 *   <li>each window is expanded on its own, slots never span two windows;</li>
 *   <li>a slot is unavailable if the day is fully blocked, or if it overlaps a partial
 *       block or an occupied booking range.</li>
 * </ul>
 */
public final class SlotGenerator {


    private SlotGenerator() {
    }

    public static List<TimeSlot> generate(LocalDate date,
                                          Collection<TimeRange> windows,
                                          int durationMinutes,
                                          boolean fullDayBlocked,
                                          Collection<TimeRange> blockedRanges,
                                          Collection<TimeRange> bookedRanges) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Slot duration must be positive: " + durationMinutes);
        }
        List<TimeRange> ordered = windows.stream()
                .sorted((a, b) -> a.start().compareTo(b.start()))
                .toList();

        List<TimeSlot> slots = new ArrayList<>();
        for (TimeRange window : ordered) {
            int windowEnd = minuteOfDay(window.end());
            int cursor = minuteOfDay(window.start());
            while (cursor + durationMinutes <= windowEnd) {
                LocalTime start = LocalTime.of(cursor / 60, cursor % 60);
                LocalTime end = LocalTime.of((cursor + durationMinutes) / 60, (cursor + durationMinutes) % 60);
                boolean available = !fullDayBlocked
                        && noneOverlap(blockedRanges, start, end)
                        && noneOverlap(bookedRanges, start, end);
                slots.add(new TimeSlot(date, start, end, available, null));
                cursor += durationMinutes;
            }
        }
        return slots;
    }

    private static boolean noneOverlap(Collection<TimeRange> ranges, LocalTime start, LocalTime end) {
        for (TimeRange range : ranges) {
            if (range.overlaps(start, end)) {
                return false;
            }
        }
        return true;
    }

    private static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
