package com.slotbooking.booking.domain.availability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotGeneratorTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 9);

    private static TimeRange range(String start, String end) {
        return new TimeRange(LocalTime.parse(start), LocalTime.parse(end));
    }

    @Test
    @DisplayName("09:00-17:00 with 60 minute slots yields 8 slots, all available")
    void fullWorkingDay() {
        List<TimeSlot> slots = SlotGenerator.generate(DATE, List.of(range("09:00", "17:00")), 60,
                false, List.of(), List.of());

        assertThat(slots).hasSize(8);
        assertThat(slots).allMatch(TimeSlot::available);
        assertThat(slots.get(0).startTime()).isEqualTo(LocalTime.of(9, 0));
        assertThat(slots.get(7).endTime()).isEqualTo(LocalTime.of(17, 0));
    }

    @Test
    @DisplayName("trailing remainder shorter than the duration is dropped")
    void trailingRemainderDropped() {
        List<TimeSlot> slots = SlotGenerator.generate(DATE, List.of(range("09:00", "10:50")), 30,
                false, List.of(), List.of());

        assertThat(slots).extracting(TimeSlot::startTime)
                .containsExactly(LocalTime.of(9, 0), LocalTime.of(9, 30), LocalTime.of(10, 0));
        assertThat(slots.get(2).endTime()).isEqualTo(LocalTime.of(10, 30));
    }

    @Test
    @DisplayName("window shorter than the duration yields no slots")
    void windowShorterThanDuration() {
        List<TimeSlot> slots = SlotGenerator.generate(DATE, List.of(range("09:00", "09:45")), 60,
                false, List.of(), List.of());

        assertThat(slots).isEmpty();
    }

    @Test
    @DisplayName("each window is sliced on its own, slots never span the gap")
    void multipleWindows() {
        List<TimeSlot> slots = SlotGenerator.generate(DATE,
                List.of(range("13:00", "15:00"), range("09:00", "11:00")), 60,
                false, List.of(), List.of());

        assertThat(slots).extracting(TimeSlot::startTime).containsExactly(
                LocalTime.of(9, 0), LocalTime.of(10, 0), LocalTime.of(13, 0), LocalTime.of(14, 0));
    }

    @Test
    @DisplayName("full-day block marks every slot unavailable")
    void fullDayBlock() {
        List<TimeSlot> slots = SlotGenerator.generate(DATE, List.of(range("09:00", "12:00")), 60,
                true, List.of(), List.of());

        assertThat(slots).hasSize(3).noneMatch(TimeSlot::available);
    }

    @Test
    @DisplayName("partial blocks and bookings only affect overlapping slots; touching edges do not overlap")
    void partialBlocksAndBookings() {
        List<TimeSlot> slots = SlotGenerator.generate(DATE, List.of(range("09:00", "13:00")), 60,
                false, List.of(range("10:30", "11:00")), List.of(range("12:00", "13:00")));

        assertThat(slots).extracting(TimeSlot::available)
                .containsExactly(true, false, true, false);
    }

    @Test
    @DisplayName("non-positive duration is rejected")
    void nonPositiveDuration() {
        assertThatThrownBy(() -> SlotGenerator.generate(DATE, List.of(range("09:00", "10:00")), 0,
                false, List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
