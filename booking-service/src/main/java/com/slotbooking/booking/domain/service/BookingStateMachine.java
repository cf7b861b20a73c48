package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStateTransition;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.BookingRepository;
import com.slotbooking.booking.domain.repository.BookingStateTransitionRepository;
import com.slotbooking.booking.domain.repository.CancellationChargeRepository;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.booking.events.BookingEventPublisher;
import com.slotbooking.booking.exception.InvalidTransitionException;
import com.slotbooking.common.exception.ResourceNotFoundException;
import com.slotbooking.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * The only path that changes a booking's status after creation.
 *
 * Each transition locks the booking row, checks the transition table, applies side effects
 * (cancellation fee, completion time), appends an audit record and, after commit,
 * publishes the matching event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingStateMachine {

    public static final String SYSTEM = "system";

    private final BookingRepository bookingRepository;
    private final ProviderRepository providerRepository;
    private final BookingStateTransitionRepository transitionRepository;
    private final CancellationChargeRepository cancellationChargeRepository;
    private final CancellationPolicy cancellationPolicy;
    private final AvailabilityCache availabilityCache;
    private final BookingEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @throws InvalidTransitionException if {@code target} is not reachable from the current status
     */
    @Transactional
    public Booking transition(Long bookingId, BookingStatus target, String triggeredBy, String reason) {
        if (target == null) {
            throw new ValidationException("Target status is required");
        }
        if (triggeredBy == null || triggeredBy.isBlank()) {
            throw new ValidationException("triggeredBy is required");
        }
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        Provider provider = providerRepository.findById(booking.getProviderId())
                .orElseThrow(() -> new ResourceNotFoundException("Provider", booking.getProviderId()));

        BookingStatus previous = booking.transitionTo(target);
        LocalDateTime now = LocalDateTime.now(clock);
        booking.setUpdatedAt(now);

        switch (target) {
            case CANCELLED -> applyCancellation(booking, previous, provider, triggeredBy, reason, now);
            case COMPLETED -> booking.setCompletedAt(now);
            default -> {
            }
        }

        Booking saved = bookingRepository.save(booking);
        transitionRepository.save(BookingStateTransition.builder()
                .bookingId(saved.getId())
                .fromStatus(previous)
                .toStatus(target)
                .triggeredBy(triggeredBy)
                .reason(reason)
                .createdAt(now)
                .build());
        availabilityCache.evict(saved.getProviderId(), saved.getBookingDate());

        switch (target) {
            case CONFIRMED -> eventPublisher.publishBookingConfirmed(saved);
            case CANCELLED -> eventPublisher.publishBookingCancelled(saved, previous);
            case COMPLETED -> eventPublisher.publishBookingCompleted(saved, provider);
            case REFUNDED -> eventPublisher.publishBookingRefunded(saved, previous, reason);
            default -> {
            }
        }

        log.info("Booking {} transitioned {} -> {} by {}", bookingId, previous, target, triggeredBy);
        return saved;
    }

    @Transactional
    public Booking confirm(Long bookingId, String triggeredBy) {
        return transition(bookingId, BookingStatus.CONFIRMED, triggeredBy, "Payment confirmed");
    }

    @Transactional
    public Booking markPaymentFailed(Long bookingId, String triggeredBy, String reason) {
        return transition(bookingId, BookingStatus.PAYMENT_FAILED, triggeredBy, reason);
    }

    @Transactional
    public Booking retryPayment(Long bookingId, String triggeredBy) {
        return transition(bookingId, BookingStatus.PENDING, triggeredBy, "Payment retry");
    }

    @Transactional
    public Booking start(Long bookingId, String triggeredBy) {
        return transition(bookingId, BookingStatus.IN_PROGRESS, triggeredBy, "Service started");
    }

    @Transactional
    public Booking complete(Long bookingId, String triggeredBy) {
        return transition(bookingId, BookingStatus.COMPLETED, triggeredBy, "Service completed");
    }

    @Transactional
    public Booking cancel(Long bookingId, String triggeredBy, String reason) {
        return transition(bookingId, BookingStatus.CANCELLED, triggeredBy, reason);
    }

    @Transactional
    public Booking markNoShow(Long bookingId, String triggeredBy) {
        return transition(bookingId, BookingStatus.NO_SHOW, triggeredBy, "Customer did not show up");
    }

    @Transactional
    public Booking refund(Long bookingId, String triggeredBy, String reason) {
        return transition(bookingId, BookingStatus.REFUNDED, triggeredBy, reason);
    }

    private void applyCancellation(Booking booking, BookingStatus previous, Provider provider,
                                   String triggeredBy, String reason, LocalDateTime now) {
        BigDecimal fee = cancellationPolicy.feeFor(booking, previous, provider.zoneId());
        booking.setCancelledAt(now);
        booking.setCancelledBy(triggeredBy);
        booking.setCancellationReason(reason);
        booking.setCancellationFee(fee);
        if (fee.signum() > 0) {
            cancellationChargeRepository.save(cancellationPolicy.chargeFor(booking, fee, now));
            log.info("Late cancellation of booking {}: fee {} of total {}", booking.getId(), fee, booking.getTotalAmount());
        }
    }
}
