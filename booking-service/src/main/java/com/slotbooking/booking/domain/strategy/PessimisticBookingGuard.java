package com.slotbooking.booking.domain.strategy;

import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.function.Function;

/**
 * Locks the provider row (SELECT FOR UPDATE) for the duration of the transaction.
 *
 * Flow:
 * 1. Acquire row lock on the provider
 * 2. Run conflict checks and insert
 * 3. Commit (releases the row lock)
 *
 * A second coordinator for the same provider blocks at step 1 and then sees the first
 * booking in its own conflict check.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticBookingGuard implements BookingGuard {

    private final ProviderRepository providerRepository;

    @Override
    @Transactional
    public <T> T execute(Long providerId, LocalDate date, Function<Provider, T> work) {
        Provider provider = providerRepository.findByIdForUpdate(providerId)
                .orElseThrow(() -> new ResourceNotFoundException("Provider", providerId));
        log.debug("Holding row lock on provider {} for booking on {}", providerId, date);
        return work.apply(provider);
    }

    @Override
    public String getGuardType() {
        return "PESSIMISTIC_LOCK";
    }
}
