package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.CancellationCharge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationPolicyTest {

    // 2026-03-09 08:00 UTC
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-09T08:00:00Z"), ZoneOffset.UTC);
    private static final ZoneId UTC = ZoneOffset.UTC;

    private CancellationPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new CancellationPolicy(CLOCK);
        ReflectionTestUtils.setField(policy, "lateWindowHours", 24L);
        ReflectionTestUtils.setField(policy, "lateFeePercent", BigDecimal.valueOf(25));
        ReflectionTestUtils.setField(policy, "platformSharePercent", BigDecimal.valueOf(10));
    }

    private static Booking booking(LocalDate date, LocalTime start) {
        return Booking.builder()
                .id(7L)
                .providerId(1L)
                .bookingDate(date)
                .startTime(start)
                .endTime(start.plusHours(1))
                .status(BookingStatus.CANCELLED)
                .totalAmount(new BigDecimal("100.00"))
                .build();
    }

    @Test
    @DisplayName("CONFIRMED booking cancelled 10 hours before start pays 25% of total")
    void lateCancellationOfConfirmedBooking() {
        Booking booking = booking(LocalDate.of(2026, 3, 9), LocalTime.of(18, 0));

        BigDecimal fee = policy.feeFor(booking, BookingStatus.CONFIRMED, UTC);

        assertThat(fee).isEqualByComparingTo("25.00");
        assertThat(fee.scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("CONFIRMED booking cancelled 48 hours before start is free")
    void earlyCancellationIsFree() {
        Booking booking = booking(LocalDate.of(2026, 3, 11), LocalTime.of(8, 0));

        assertThat(policy.feeFor(booking, BookingStatus.CONFIRMED, UTC)).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("cancellation exactly at the late-window boundary is free")
    void boundaryIsFree() {
        Booking booking = booking(LocalDate.of(2026, 3, 10), LocalTime.of(8, 0));

        assertThat(policy.feeFor(booking, BookingStatus.CONFIRMED, UTC)).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("PENDING booking never pays a fee, even inside the late window")
    void pendingCancellationIsFree() {
        Booking booking = booking(LocalDate.of(2026, 3, 9), LocalTime.of(10, 0));

        assertThat(policy.feeFor(booking, BookingStatus.PENDING, UTC)).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("start time is read in the provider's zone")
    void providerZoneApplies() {
        Booking booking = booking(LocalDate.of(2026, 3, 12), LocalTime.of(18, 0));
        // 18:00 in Tokyo is 09:00 UTC, one hour away
        Booking sameDayTokyo = booking(LocalDate.of(2026, 3, 9), LocalTime.of(18, 0));

        assertThat(policy.feeFor(booking, BookingStatus.CONFIRMED, ZoneId.of("Asia/Tokyo"))).isEqualByComparingTo("0.00");
        assertThat(policy.feeFor(sameDayTokyo, BookingStatus.CONFIRMED, ZoneId.of("Asia/Tokyo"))).isEqualByComparingTo("25.00");
    }

    @Test
    @DisplayName("charge splits the fee 10% platform and 90% provider")
    void chargeSplit() {
        Booking booking = booking(LocalDate.of(2026, 3, 9), LocalTime.of(18, 0));
        LocalDateTime now = LocalDateTime.now(CLOCK);

        CancellationCharge charge = policy.chargeFor(booking, new BigDecimal("25.00"), now);

        assertThat(charge.getBookingId()).isEqualTo(7L);
        assertThat(charge.getAmount()).isEqualByComparingTo("25.00");
        assertThat(charge.getPlatformShare()).isEqualByComparingTo("2.50");
        assertThat(charge.getProviderShare()).isEqualByComparingTo("22.50");
        assertThat(charge.getCreatedAt()).isEqualTo(now);
    }
}
