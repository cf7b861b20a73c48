package com.slotbooking.booking.job;

import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.BookingRepository;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.booking.domain.service.BookingStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Completes bookings whose end, in the provider's zone, lies more than the grace period
 * in the past. The query only returns due bookings, oldest first.
 * CONFIRMED bookings pass through IN_PROGRESS first. Each transition commits on its own,
 * so one failing booking does not hold back the rest of the batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCompletionJob {

    private static final int BATCH_SIZE = 200;
    private static final List<String> AUTO_COMPLETED =
            List.of(BookingStatus.CONFIRMED.name(), BookingStatus.IN_PROGRESS.name());

    private final BookingRepository bookingRepository;
    private final ProviderRepository providerRepository;
    private final BookingStateMachine stateMachine;
    private final Clock clock;

    @Value("${booking.completion.auto-complete-enabled:true}")
    private boolean enabled;

    @Value("${booking.completion.grace-minutes:60}")
    private int graceMinutes;

    @Scheduled(fixedDelayString = "${booking.completion.interval-ms:300000}")
    public void completeFinishedBookings() {
        if (!enabled) return;
        LocalDateTime dueBefore = LocalDateTime.now(clock).minusMinutes(graceMinutes);
        List<Booking> candidates = bookingRepository.findDueForCompletion(AUTO_COMPLETED, dueBefore, BATCH_SIZE);
        if (candidates.isEmpty()) return;

        Map<Long, Provider> providers = new HashMap<>();
        int completed = 0;
        for (Booking booking : candidates) {
            Provider provider = providers.computeIfAbsent(booking.getProviderId(),
                    id -> providerRepository.findById(id).orElse(null));
            if (provider == null) {
                log.warn("Booking {} references unknown provider {}", booking.getId(), booking.getProviderId());
                continue;
            }
            ZonedDateTime due = booking.endsAt(provider.zoneId()).plusMinutes(graceMinutes);
            if (due.isAfter(ZonedDateTime.now(clock))) {
                continue;
            }
            try {
                if (booking.getStatus() == BookingStatus.CONFIRMED) {
                    stateMachine.start(booking.getId(), BookingStateMachine.SYSTEM);
                }
                stateMachine.complete(booking.getId(), BookingStateMachine.SYSTEM);
                completed++;
            } catch (Exception e) {
                log.error("Auto-completion failed for booking {}", booking.getId(), e);
            }
        }
        if (completed > 0) {
            log.info("Auto-completed {} booking(s)", completed);
        }
    }
}
