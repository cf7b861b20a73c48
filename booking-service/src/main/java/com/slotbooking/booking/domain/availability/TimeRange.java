package com.slotbooking.booking.domain.availability;

import java.time.LocalTime;

/**
 * Same-day half-open wall-clock range [start, end).
 */
public record TimeRange(LocalTime start, LocalTime end) {

    public TimeRange {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Time range requires start before end: " + start + " - " + end);
        }
    }

    /** Half-open overlap: [s1,e1) and [s2,e2) overlap iff s1 < e2 and s2 < e1. */
    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean overlaps(LocalTime otherStart, LocalTime otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }
}
