package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.CancellationCharge;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Late-cancellation fee: only a CONFIRMED booking cancelled less than the late window
 * before its start (in the provider's zone) pays a percentage of the total.
 * Cancelling from any other state is free.
 */
@Component
public class CancellationPolicy {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal NO_FEE = BigDecimal.ZERO.setScale(2);

    private final Clock clock;

    @Value("${booking.cancellation.late-window-hours:24}")
    private long lateWindowHours;

    @Value("${booking.cancellation.late-fee-percent:25}")
    private BigDecimal lateFeePercent;

    @Value("${booking.pricing.platform-fee-percent:10}")
    private BigDecimal platformSharePercent;

    public CancellationPolicy(Clock clock) {
        this.clock = clock;
    }

    public BigDecimal feeFor(Booking booking, BookingStatus cancelledFrom, ZoneId providerZone) {
        if (cancelledFrom != BookingStatus.CONFIRMED) {
            return NO_FEE;
        }
        ZonedDateTime startsAt = booking.startsAt(providerZone);
        Duration untilStart = Duration.between(ZonedDateTime.now(clock), startsAt);
        if (untilStart.compareTo(Duration.ofHours(lateWindowHours)) >= 0) {
            return NO_FEE;
        }
        return booking.getTotalAmount().multiply(lateFeePercent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    /** Splits a fee between platform and provider with the platform fee rate. */
    public CancellationCharge chargeFor(Booking booking, BigDecimal fee, LocalDateTime now) {
        BigDecimal platformShare = fee.multiply(platformSharePercent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        return CancellationCharge.builder()
                .bookingId(booking.getId())
                .amount(fee)
                .platformShare(platformShare)
                .providerShare(fee.subtract(platformShare))
                .createdAt(now)
                .build();
    }
}
