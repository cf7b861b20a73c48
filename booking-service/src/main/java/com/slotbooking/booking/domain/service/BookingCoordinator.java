package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.availability.TimeRange;
import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStateTransition;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.AvailabilityWindowRepository;
import com.slotbooking.booking.domain.repository.BlockedSlotRepository;
import com.slotbooking.booking.domain.repository.BookingRepository;
import com.slotbooking.booking.domain.repository.BookingStateTransitionRepository;
import com.slotbooking.booking.domain.strategy.BookingGuard;
import com.slotbooking.booking.exception.SlotConflictException;
import com.slotbooking.common.exception.ConflictException;
import com.slotbooking.common.exception.ValidationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * Sole authority for creating bookings.
 *
 * Inside one transaction, serialized per provider by the configured {@link BookingGuard}:
 * 1. re-check occupying bookings for overlap (starts inside, ends inside, contains)
 * 2. require the range to lie inside an active weekly window
 * 3. reject ranges hitting a full-day or partial block
 * 4. generate a confirmation code unless one was supplied
 * 5. insert the booking and its creation audit record
 *
 * Slot locks and the availability cache are never consulted here. The bookings
 * exclusion constraint catches anything the guard lets through.
 *
 * Configuration:
 * booking.coordinator.guard: pessimistic | distributed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingCoordinator {

    static final String OVERLAP_CONSTRAINT = "bookings_no_overlap";
    static final String CODE_CONSTRAINT = "uk_bookings_confirmation_code";
    private static final int MAX_CODE_ATTEMPTS = 3;

    private final Map<String, BookingGuard> bookingGuards;
    private final BookingRepository bookingRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final BlockedSlotRepository blockedSlotRepository;
    private final BookingStateTransitionRepository transitionRepository;
    private final ConfirmationCodeGenerator codeGenerator;
    private final SlotLockService slotLockService;
    private final AvailabilityCache availabilityCache;
    private final PricingPolicy pricingPolicy;
    private final Clock clock;

    @Value("${booking.coordinator.guard:pessimistic}")
    private String guardType;

    @PostConstruct
    public void init() {
        log.info("Initialized BookingCoordinator with guard: {}", getBookingGuard().getGuardType());
    }

    /**
     * Creates a PENDING booking.
     *
     * @throws SlotConflictException the range overlaps an occupying booking
     * @throws ValidationException   outside availability, blocked, malformed input or price
     */
    public Booking createBooking(CreateBookingCommand command) {
        validateCommand(command);
        PriceBreakdown price = pricingPolicy.price(command.servicePrice(), command.platformFee(),
                command.providerPayout(), command.isGuest());
        BookingGuard guard = getBookingGuard();

        for (int attempt = 1; ; attempt++) {
            String code = command.confirmationCode() != null ? command.confirmationCode() : codeGenerator.generate();
            try {
                Booking booking = guard.execute(command.providerId(), command.date(),
                        provider -> insertBooking(provider, command, price, code));
                log.info("Created booking {} ({}) for provider {} on {} {}-{}", booking.getId(),
                        booking.getConfirmationCode(), booking.getProviderId(), booking.getBookingDate(),
                        booking.getStartTime(), booking.getEndTime());
                return booking;
            } catch (DataIntegrityViolationException e) {
                String violation = String.valueOf(e.getMostSpecificCause().getMessage());
                if (violation.contains(OVERLAP_CONSTRAINT)) {
                    log.warn("Overlap for provider {} on {} {}-{} rejected by exclusion constraint",
                            command.providerId(), command.date(), command.startTime(), command.endTime());
                    throw new SlotConflictException(null,
                            "Requested slot was booked concurrently by another customer", e);
                }
                if (violation.contains(CODE_CONSTRAINT)) {
                    if (command.confirmationCode() != null) {
                        throw new ConflictException("Confirmation code " + code + " is already in use",
                                e, "DUPLICATE_CONFIRMATION_CODE");
                    }
                    if (attempt < MAX_CODE_ATTEMPTS) {
                        log.warn("Confirmation code collision on attempt {}, regenerating", attempt);
                        continue;
                    }
                }
                throw e;
            }
        }
    }

    private Booking insertBooking(Provider provider, CreateBookingCommand command, PriceBreakdown price, String code) {
        if (!provider.isActive()) {
            throw new ValidationException("Provider " + provider.getId() + " is not accepting bookings");
        }
        ZonedDateTime startsAt = ZonedDateTime.of(command.date(), command.startTime(), provider.zoneId());
        if (startsAt.isBefore(ZonedDateTime.now(clock))) {
            throw new ValidationException("Cannot book a slot that has already started");
        }

        List<Booking> conflicts = bookingRepository.findConflicting(provider.getId(), command.date(),
                command.startTime(), command.endTime(), BookingStatus.SLOT_RELEASING);
        if (!conflicts.isEmpty()) {
            Booking blocking = conflicts.get(0);
            throw new SlotConflictException(blocking.getId(), String.format(
                    "Requested %s %s-%s overlaps existing booking %s-%s",
                    command.date(), command.startTime(), command.endTime(),
                    blocking.getStartTime(), blocking.getEndTime()));
        }

        boolean insideWindow = windowRepository
                .findByProviderIdAndDayOfWeekAndActiveTrue(provider.getId(), command.date().getDayOfWeek()).stream()
                .anyMatch(w -> w.contains(command.startTime(), command.endTime()));
        if (!insideWindow) {
            throw new ValidationException(String.format("Requested %s-%s is outside provider availability on %s",
                    command.startTime(), command.endTime(), command.date().getDayOfWeek()), "OUTSIDE_AVAILABILITY");
        }

        TimeRange requested = new TimeRange(command.startTime(), command.endTime());
        boolean blocked = blockedSlotRepository.findByProviderIdAndBlockedDate(provider.getId(), command.date()).stream()
                .anyMatch(b -> b.isFullDay() || requested.overlaps(b.getStartTime(), b.getEndTime()));
        if (blocked) {
            throw new ValidationException("Requested time is blocked by the provider", "SLOT_BLOCKED");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Booking booking = bookingRepository.saveAndFlush(Booking.builder()
                .providerId(provider.getId())
                .customerId(command.customerId())
                .guestEmail(command.guestEmail())
                .guestName(command.guestName())
                .bookingDate(command.date())
                .startTime(command.startTime())
                .endTime(command.endTime())
                .status(BookingStatus.PENDING)
                .totalAmount(price.totalAmount())
                .guestSurcharge(price.guestSurcharge())
                .platformFee(price.platformFee())
                .providerPayout(price.providerPayout())
                .confirmationCode(code)
                .createdAt(now)
                .updatedAt(now)
                .build());

        transitionRepository.save(BookingStateTransition.builder()
                .bookingId(booking.getId())
                .fromStatus(null)
                .toStatus(BookingStatus.PENDING)
                .triggeredBy(booking.bookedBy())
                .reason("Booking created")
                .createdAt(now)
                .build());

        if (command.lockId() != null) {
            slotLockService.release(command.lockId());
        }
        availabilityCache.evict(provider.getId(), command.date());
        return booking;
    }

    private void validateCommand(CreateBookingCommand command) {
        if (command.providerId() == null || command.date() == null) {
            throw new ValidationException("Provider and date are required");
        }
        if (command.startTime() == null || command.endTime() == null
                || !command.startTime().isBefore(command.endTime())) {
            throw new ValidationException("Booking range requires start before end on the same day");
        }
        if (command.customerId() == null && !command.isGuest()) {
            throw new ValidationException("Either a customer id or a guest email is required");
        }
    }

    /**
     * Looks up the configured guard by bean name, falling back to pessimistic.
     */
    private BookingGuard getBookingGuard() {
        BookingGuard guard = bookingGuards.get(guardType.toLowerCase());
        if (guard == null) {
            log.warn("Unknown booking guard: {}. Available guards: {}. Defaulting to pessimistic",
                    guardType, bookingGuards.keySet());
            guard = bookingGuards.get("pessimistic");
            if (guard == null) {
                throw new IllegalStateException("pessimistic guard not found. Available guards: " + bookingGuards.keySet());
            }
        }
        return guard;
    }
}
