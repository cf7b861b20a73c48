package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.api.dto.BookingResponse;
import com.slotbooking.booking.api.dto.BookingTransitionResponse;
import com.slotbooking.booking.api.dto.CreateBookingRequest;
import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.BookingRepository;
import com.slotbooking.booking.domain.repository.BookingStateTransitionRepository;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.booking.exception.SlotConflictException;
import com.slotbooking.common.exception.ResourceNotFoundException;
import com.slotbooking.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point of the booking API: creation through the coordinator, status changes
 * through the state machine, plus the read side.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final EnumSet<BookingStatus> UPCOMING = EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    private final BookingCoordinator coordinator;
    private final BookingStateMachine stateMachine;
    private final AvailabilityService availabilityService;
    private final BookingRepository bookingRepository;
    private final BookingStateTransitionRepository transitionRepository;
    private final ProviderRepository providerRepository;
    private final Clock clock;

    /**
     * Creates a PENDING booking. A slot conflict is rethrown with alternative slots of the
     * same length attached.
     */
    public BookingResponse createBooking(CreateBookingRequest request) {
        log.info("Creating booking for provider {} on {} {}-{}", request.providerId(), request.date(),
                request.startTime(), request.endTime());
        CreateBookingCommand command = CreateBookingCommand.builder()
                .providerId(request.providerId())
                .customerId(request.customerId())
                .guestEmail(request.guestEmail())
                .guestName(request.guestName())
                .date(request.date())
                .startTime(request.startTime())
                .endTime(request.endTime())
                .servicePrice(request.servicePrice())
                .platformFee(request.platformFee())
                .providerPayout(request.providerPayout())
                .confirmationCode(request.confirmationCode())
                .lockId(request.lockId())
                .build();
        try {
            return BookingResponse.from(coordinator.createBooking(command));
        } catch (SlotConflictException e) {
            int minutes = (int) Duration.between(request.startTime(), request.endTime()).toMinutes();
            throw e.withAlternatives(availabilityService.findAlternativeSlots(request.providerId(), request.date(),
                    minutes, request.startTime(), request.endTime()));
        }
    }

    @Transactional(readOnly = true)
    public BookingResponse getBookingById(Long id) {
        return BookingResponse.from(findBooking(id));
    }

    @Transactional(readOnly = true)
    public BookingResponse getBookingByConfirmationCode(String code) {
        Booking booking = bookingRepository.findByConfirmationCode(code)
                .orElseThrow(() -> new ResourceNotFoundException("Booking with confirmation code " + code + " not found"));
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getBookingsByCustomerId(Long customerId) {
        return bookingRepository.findByCustomerIdOrderByBookingDateDescStartTimeDesc(customerId).stream()
                .map(BookingResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * PENDING and CONFIRMED bookings from today on (provider zone), soonest first.
     */
    @Transactional(readOnly = true)
    public List<BookingResponse> getUpcomingBookings(Long providerId, int limit) {
        if (limit < 1 || limit > 100) {
            throw new ValidationException("Limit must be between 1 and 100");
        }
        Provider provider = findProvider(providerId);
        LocalDate today = LocalDate.now(clock.withZone(provider.zoneId()));
        return bookingRepository.findUpcoming(providerId, today, UPCOMING, PageRequest.of(0, limit)).stream()
                .map(BookingResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Counts and revenue over bookings dated in [from, to]. Revenue is the provider payout
     * of completed bookings.
     */
    @Transactional(readOnly = true)
    public ProviderBookingStats getProviderStats(Long providerId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new ValidationException("Range end must not be before its start");
        }
        Provider provider = findProvider(providerId);
        LocalDate today = LocalDate.now(clock.withZone(provider.zoneId()));
        List<Booking> bookings = bookingRepository.findByProviderIdAndBookingDateBetween(providerId, from, to);

        Map<BookingStatus, Long> byStatus = bookings.stream()
                .collect(Collectors.groupingBy(Booking::getStatus, Collectors.counting()));
        long completed = byStatus.getOrDefault(BookingStatus.COMPLETED, 0L);
        long cancelled = byStatus.getOrDefault(BookingStatus.CANCELLED, 0L);
        long upcoming = bookings.stream()
                .filter(b -> UPCOMING.contains(b.getStatus()) && !b.getBookingDate().isBefore(today))
                .count();
        BigDecimal revenue = sum(bookings.stream()
                .filter(b -> b.getStatus() == BookingStatus.COMPLETED)
                .toList(), Booking::getProviderPayout);
        BigDecimal average = completed == 0
                ? BigDecimal.ZERO.setScale(2)
                : revenue.divide(BigDecimal.valueOf(completed), 2, RoundingMode.HALF_UP);

        return new ProviderBookingStats(bookings.size(), completed, upcoming, cancelled, revenue, average);
    }

    public BookingResponse transition(Long bookingId, BookingStatus target, String triggeredBy, String reason) {
        return BookingResponse.from(stateMachine.transition(bookingId, target, triggeredBy, reason));
    }

    public BookingResponse confirm(Long bookingId, String triggeredBy) {
        return BookingResponse.from(stateMachine.confirm(bookingId, triggeredBy));
    }

    public BookingResponse markPaymentFailed(Long bookingId, String triggeredBy, String reason) {
        return BookingResponse.from(stateMachine.markPaymentFailed(bookingId, triggeredBy, reason));
    }

    public BookingResponse retryPayment(Long bookingId, String triggeredBy) {
        return BookingResponse.from(stateMachine.retryPayment(bookingId, triggeredBy));
    }

    public BookingResponse start(Long bookingId, String triggeredBy) {
        return BookingResponse.from(stateMachine.start(bookingId, triggeredBy));
    }

    public BookingResponse complete(Long bookingId, String triggeredBy) {
        return BookingResponse.from(stateMachine.complete(bookingId, triggeredBy));
    }

    public BookingResponse cancel(Long bookingId, String triggeredBy, String reason) {
        return BookingResponse.from(stateMachine.cancel(bookingId, triggeredBy, reason));
    }

    public BookingResponse markNoShow(Long bookingId, String triggeredBy) {
        return BookingResponse.from(stateMachine.markNoShow(bookingId, triggeredBy));
    }

    public BookingResponse refund(Long bookingId, String triggeredBy, String reason) {
        return BookingResponse.from(stateMachine.refund(bookingId, triggeredBy, reason));
    }

    @Transactional(readOnly = true)
    public List<BookingTransitionResponse> getTransitions(Long bookingId) {
        findBooking(bookingId);
        return transitionRepository.findByBookingIdOrderByCreatedAtAscIdAsc(bookingId).stream()
                .map(BookingTransitionResponse::from)
                .collect(Collectors.toList());
    }

    private Booking findBooking(Long id) {
        return bookingRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", id));
    }

    private Provider findProvider(Long providerId) {
        return providerRepository.findById(providerId)
                .orElseThrow(() -> new ResourceNotFoundException("Provider", providerId));
    }

    private static BigDecimal sum(List<Booking> bookings, Function<Booking, BigDecimal> amount) {
        return bookings.stream()
                .map(amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
