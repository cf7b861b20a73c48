package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.availability.DayAvailability;
import com.slotbooking.booking.domain.availability.ProviderAvailability;
import com.slotbooking.booking.domain.availability.SlotGenerator;
import com.slotbooking.booking.domain.availability.TimeRange;
import com.slotbooking.booking.domain.availability.TimeSlot;
import com.slotbooking.booking.domain.model.AvailabilityWindow;
import com.slotbooking.booking.domain.model.BlockedSlot;
import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.model.SlotLock;
import com.slotbooking.booking.domain.repository.AvailabilityWindowRepository;
import com.slotbooking.booking.domain.repository.BlockedSlotRepository;
import com.slotbooking.booking.domain.repository.BookingRepository;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.booking.domain.repository.SlotLockRepository;
import com.slotbooking.common.exception.ResourceNotFoundException;
import com.slotbooking.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Computes bookable slots for a provider from weekly windows, blocked dates, occupying
 * bookings and advisory locks. Results are a lagging projection: the booking coordinator
 * re-validates against the database and never reads them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final ProviderRepository providerRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final BlockedSlotRepository blockedSlotRepository;
    private final BookingRepository bookingRepository;
    private final SlotLockRepository slotLockRepository;
    private final AvailabilityCache availabilityCache;
    private final Clock clock;

    @Value("${booking.availability.default-slot-minutes:15}")
    private int defaultSlotMinutes;

    @Value("${booking.availability.max-range-days:31}")
    private int maxRangeDays;

    @Value("${booking.availability.alternatives-limit:5}")
    private int alternativesLimit;

    @Value("${booking.availability.alternatives-days-ahead:7}")
    private int alternativesDaysAhead;

    /**
     * One entry per date in [from, to], in the provider's wall-clock time. Slots that already
     * started in the provider's zone are reported unavailable. {@code timezone} (provider zone
     * when null) is validated and echoed back; it does not shift the slots.
     */
    @Transactional(readOnly = true)
    public ProviderAvailability getAvailability(Long providerId, LocalDate from, LocalDate to,
                                                Integer durationMinutes, String timezone) {
        LocalDate end = to != null ? to : from;
        int duration = durationMinutes != null ? durationMinutes : defaultSlotMinutes;
        validateRange(from, end, duration);

        Provider provider = providerRepository.findById(providerId)
                .orElseThrow(() -> new ResourceNotFoundException("Provider", providerId));
        ZoneId providerZone = provider.zoneId();
        ZoneId requestedZone = resolveZone(timezone, provider);

        Map<LocalDate, List<TimeSlot>> slotsByDate = provider.isActive()
                ? slotsFor(providerId, from, end, duration)
                : emptyDays(from, end);

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(providerZone));
        List<DayAvailability> days = new ArrayList<>();
        slotsByDate.forEach((date, slots) -> days.add(new DayAvailability(date, slots.stream()
                .map(slot -> hasStarted(slot, providerZone, now) ? slot.unavailable() : slot)
                .toList())));
        return new ProviderAvailability(providerId, providerZone.getId(), requestedZone.getId(), days);
    }

    /**
     * Authoritative-looking but advisory check used before granting a slot lock: the range
     * sits inside an active window, hits no block and overlaps no occupying booking.
     */
    @Transactional(readOnly = true)
    public boolean isSlotAvailable(Long providerId, LocalDate date, LocalTime start, LocalTime end) {
        boolean insideWindow = windowRepository
                .findByProviderIdAndDayOfWeekAndActiveTrue(providerId, date.getDayOfWeek()).stream()
                .anyMatch(w -> w.contains(start, end));
        if (!insideWindow) {
            return false;
        }
        TimeRange requested = new TimeRange(start, end);
        boolean blocked = blockedSlotRepository.findByProviderIdAndBlockedDate(providerId, date).stream()
                .anyMatch(b -> b.isFullDay() || requested.overlaps(b.getStartTime(), b.getEndTime()));
        if (blocked) {
            return false;
        }
        return bookingRepository.findConflicting(providerId, date, start, end, BookingStatus.SLOT_RELEASING).isEmpty();
    }

    /**
     * Free slots of the requested length that do not overlap the rejected range: first on
     * the same date, then on the following days, capped at the configured limit.
     */
    @Transactional(readOnly = true)
    public List<TimeSlot> findAlternativeSlots(Long providerId, LocalDate date, int durationMinutes,
                                               LocalTime excludeStart, LocalTime excludeEnd) {
        Provider provider = providerRepository.findById(providerId)
                .orElseThrow(() -> new ResourceNotFoundException("Provider", providerId));
        if (!provider.isActive() || durationMinutes <= 0) {
            return List.of();
        }
        ZoneId zone = provider.zoneId();
        ZonedDateTime zonedNow = ZonedDateTime.now(clock.withZone(zone));
        LocalDateTime lockNow = LocalDateTime.now(clock);
        TimeRange excluded = excludeStart != null && excludeEnd != null && excludeStart.isBefore(excludeEnd)
                ? new TimeRange(excludeStart, excludeEnd) : null;

        Map<LocalDate, List<TimeSlot>> slots = slotsFor(providerId, date, date.plusDays(alternativesDaysAhead), durationMinutes);
        List<TimeSlot> alternatives = new ArrayList<>();
        for (Map.Entry<LocalDate, List<TimeSlot>> day : slots.entrySet()) {
            boolean sameDay = day.getKey().equals(date);
            for (TimeSlot slot : day.getValue()) {
                if (alternatives.size() >= alternativesLimit) {
                    return alternatives;
                }
                if (!slot.isFree(lockNow) || hasStarted(slot, zone, zonedNow)) continue;
                if (sameDay && excluded != null && excluded.overlaps(slot.range())) continue;
                alternatives.add(slot);
            }
        }
        log.debug("Found {} alternative slots for provider {} around {}", alternatives.size(), providerId, date);
        return alternatives;
    }

    /**
     * Per-date slots, read from cache where present and computed for the misses.
     * Dates without an active window map to an empty list.
     */
    Map<LocalDate, List<TimeSlot>> slotsFor(Long providerId, LocalDate from, LocalDate to, int duration) {
        Map<LocalDate, List<TimeSlot>> result = new LinkedHashMap<>();
        List<LocalDate> misses = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            final LocalDate day = date;
            availabilityCache.get(providerId, date, duration).ifPresentOrElse(
                    slots -> result.put(day, slots),
                    () -> {
                        result.put(day, null);
                        misses.add(day);
                    });
        }
        if (misses.isEmpty()) {
            return result;
        }

        LocalDate missFrom = misses.get(0);
        LocalDate missTo = misses.get(misses.size() - 1);
        Map<DayOfWeek, List<TimeRange>> windowsByDay = windowRepository.findByProviderIdAndActiveTrue(providerId)
                .stream()
                .collect(Collectors.groupingBy(AvailabilityWindow::getDayOfWeek,
                        Collectors.mapping(w -> new TimeRange(w.getStartTime(), w.getEndTime()), Collectors.toList())));
        Map<LocalDate, List<BlockedSlot>> blocksByDate = blockedSlotRepository
                .findByProviderIdAndBlockedDateBetweenOrderByBlockedDateAsc(providerId, missFrom, missTo).stream()
                .collect(Collectors.groupingBy(BlockedSlot::getBlockedDate));
        Map<LocalDate, List<TimeRange>> bookedByDate = bookingRepository
                .findOccupying(providerId, missFrom, missTo, BookingStatus.SLOT_RELEASING).stream()
                .collect(Collectors.groupingBy(Booking::getBookingDate,
                        Collectors.mapping(b -> new TimeRange(b.getStartTime(), b.getEndTime()), Collectors.toList())));
        Map<LocalDate, List<SlotLock>> locksByDate = slotLockRepository
                .findActive(providerId, missFrom, missTo, LocalDateTime.now(clock)).stream()
                .collect(Collectors.groupingBy(SlotLock::getSlotDate));

        for (LocalDate date : misses) {
            List<BlockedSlot> blocks = blocksByDate.getOrDefault(date, List.of());
            boolean fullDay = blocks.stream().anyMatch(BlockedSlot::isFullDay);
            List<TimeRange> partialBlocks = blocks.stream()
                    .filter(b -> !b.isFullDay())
                    .map(b -> new TimeRange(b.getStartTime(), b.getEndTime()))
                    .toList();
            List<TimeSlot> slots = SlotGenerator.generate(date,
                    windowsByDay.getOrDefault(date.getDayOfWeek(), List.of()),
                    duration, fullDay, partialBlocks,
                    bookedByDate.getOrDefault(date, List.of()));
            List<TimeSlot> withLocks = overlayLocks(slots, locksByDate.getOrDefault(date, List.of()));
            availabilityCache.put(providerId, date, duration, withLocks);
            result.put(date, withLocks);
        }
        return result;
    }

    private List<TimeSlot> overlayLocks(List<TimeSlot> slots, List<SlotLock> locks) {
        if (locks.isEmpty()) {
            return slots;
        }
        return slots.stream().map(slot -> {
            LocalDateTime until = null;
            for (SlotLock lock : locks) {
                if (slot.range().overlaps(lock.getStartTime(), lock.getEndTime())
                        && (until == null || lock.getLockedUntil().isAfter(until))) {
                    until = lock.getLockedUntil();
                }
            }
            return until == null ? slot : slot.withLockedUntil(until);
        }).toList();
    }

    private boolean hasStarted(TimeSlot slot, ZoneId zone, ZonedDateTime now) {
        return ZonedDateTime.of(slot.date(), slot.startTime(), zone).isBefore(now);
    }

    private Map<LocalDate, List<TimeSlot>> emptyDays(LocalDate from, LocalDate to) {
        Map<LocalDate, List<TimeSlot>> result = new LinkedHashMap<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            result.put(date, List.of());
        }
        return result;
    }

    private void validateRange(LocalDate from, LocalDate to, int duration) {
        if (from == null) {
            throw new ValidationException("Start date is required");
        }
        if (to.isBefore(from)) {
            throw new ValidationException("End date " + to + " is before start date " + from);
        }
        if (ChronoUnit.DAYS.between(from, to) + 1 > maxRangeDays) {
            throw new ValidationException("Date range exceeds " + maxRangeDays + " days");
        }
        if (duration <= 0 || duration > 24 * 60) {
            throw new ValidationException("Slot duration must be between 1 and 1440 minutes");
        }
    }

    private ZoneId resolveZone(String timezone, Provider provider) {
        if (timezone == null || timezone.isBlank()) {
            return provider.zoneId();
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone: " + timezone);
        }
    }
}
