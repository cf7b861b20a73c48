package com.slotbooking.booking.domain.strategy;

import com.slotbooking.booking.domain.model.Provider;

import java.time.LocalDate;
import java.util.function.Function;

/**
 * Serializes concurrent booking attempts for the same provider and date and runs the
 * check-then-insert work inside one database transaction.
 *
 * Implementations (bean names):
 * - pessimistic: SELECT ... FOR UPDATE on the provider row
 * - distributed: Redisson lock on provider and date, then a plain transaction
 *
 * Either way the bookings exclusion constraint remains the final backstop.
 */
public interface BookingGuard {

    <T> T execute(Long providerId, LocalDate date, Function<Provider, T> work);

    String getGuardType();
}
