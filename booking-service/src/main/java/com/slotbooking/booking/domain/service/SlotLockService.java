package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.availability.TimeSlot;
import com.slotbooking.booking.domain.model.SlotLock;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.booking.domain.repository.SlotLockRepository;
import com.slotbooking.common.exception.ResourceNotFoundException;
import com.slotbooking.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * Short-lived advisory claims on slots during checkout.
 *
 * Locks only reduce contention before the booking coordinator runs; they are never
 * checked when a booking is committed. Lock state lives in the shared database so every
 * instance sees the same claims.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotLockService {

    private final SlotLockRepository slotLockRepository;
    private final ProviderRepository providerRepository;
    private final AvailabilityService availabilityService;
    private final AvailabilityCache availabilityCache;
    private final Clock clock;

    @Value("${booking.lock.default-ttl-minutes:10}")
    private int defaultTtlMinutes;

    @Value("${booking.lock.max-ttl-minutes:60}")
    private int maxTtlMinutes;

    /**
     * Claims [start, end) for {@code sessionId} until now + ttl. Re-acquiring with the same
     * session refreshes the expiry and keeps the lock id.
     *
     * @param ttl lock lifetime, default when null
     * @return acquired handle, or a contested result with alternatives
     */
    @Transactional
    public SlotLockResult acquire(Long providerId, LocalDate date, LocalTime start, LocalTime end,
                                  String sessionId, Duration ttl) {
        validate(date, start, end, sessionId, ttl);
        if (!providerRepository.existsById(providerId)) {
            throw new ResourceNotFoundException("Provider", providerId);
        }
        Duration lifetime = ttl != null ? ttl : Duration.ofMinutes(defaultTtlMinutes);
        LocalDateTime now = LocalDateTime.now(clock);

        if (!availabilityService.isSlotAvailable(providerId, date, start, end)) {
            log.info("Slot {} {}-{} for provider {} is not available, lock refused", date, start, end, providerId);
            return contested(providerId, date, start, end);
        }
        List<SlotLock> heldByOthers = slotLockRepository.findActiveOverlappingHeldByOthers(
                providerId, date, start, end, sessionId, now);
        if (!heldByOthers.isEmpty()) {
            log.info("Slot {} {}-{} for provider {} overlaps a lock held until {}",
                    date, start, end, providerId, heldByOthers.get(0).getLockedUntil());
            return contested(providerId, date, start, end);
        }

        LocalDateTime lockedUntil = now.plus(lifetime);
        int updated = slotLockRepository.tryAcquire(UUID.randomUUID(), providerId, date, start, end,
                sessionId, lockedUntil, now);
        if (updated == 0) {
            log.info("Lost race for slot {} {}-{} of provider {}", date, start, end, providerId);
            return contested(providerId, date, start, end);
        }

        SlotLock lock = slotLockRepository.findByProviderIdAndSlotDateAndStartTimeAndEndTime(providerId, date, start, end)
                .orElseThrow(() -> new IllegalStateException("Slot lock vanished right after acquisition"));
        availabilityCache.evict(providerId, date);
        log.debug("Acquired slot lock {} on provider {} {} {}-{} until {}", lock.getId(), providerId, date, start, end, lockedUntil);
        return SlotLockResult.acquired(lock.getId(), lock.getLockedUntil());
    }

    /**
     * Idempotent: releasing an unknown or already expired lock is a no-op.
     */
    @Transactional
    public void release(UUID lockId) {
        slotLockRepository.findById(lockId).ifPresent(lock -> {
            slotLockRepository.deleteLock(lockId);
            availabilityCache.evict(lock.getProviderId(), lock.getSlotDate());
            log.debug("Released slot lock {}", lockId);
        });
    }

    /**
     * Housekeeping only: expired locks are already ignored by the free-slot test.
     */
    @Scheduled(fixedDelayString = "${booking.lock.sweep-interval-ms:60000}")
    @Transactional
    public void releaseExpiredLocks() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<SlotLock> expired = slotLockRepository.findExpired(now);
        if (expired.isEmpty()) return;
        int deleted = slotLockRepository.deleteExpired(now);
        expired.stream()
                .map(l -> new ProviderDate(l.getProviderId(), l.getSlotDate()))
                .distinct()
                .forEach(pd -> availabilityCache.evict(pd.providerId(), pd.date()));
        log.info("Released {} expired slot locks", deleted);
    }

    private SlotLockResult contested(Long providerId, LocalDate date, LocalTime start, LocalTime end) {
        int duration = (int) Duration.between(start, end).toMinutes();
        List<TimeSlot> alternatives = availabilityService.findAlternativeSlots(providerId, date, duration, start, end);
        return SlotLockResult.contested(alternatives);
    }

    private record ProviderDate(Long providerId, LocalDate date) {
    }

    private void validate(LocalDate date, LocalTime start, LocalTime end, String sessionId, Duration ttl) {
        if (date == null) {
            throw new ValidationException("Lock date is required");
        }
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ValidationException("Lock range requires start before end");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("Session id is required");
        }
        if (ttl != null && (ttl.isNegative() || ttl.isZero() || ttl.toMinutes() > maxTtlMinutes)) {
            throw new ValidationException("Lock TTL must be positive and at most " + maxTtlMinutes + " minutes");
        }
    }
}
