package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStateTransition;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.CancellationCharge;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.BookingRepository;
import com.slotbooking.booking.domain.repository.BookingStateTransitionRepository;
import com.slotbooking.booking.domain.repository.CancellationChargeRepository;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.booking.events.BookingEventPublisher;
import com.slotbooking.booking.exception.InvalidTransitionException;
import com.slotbooking.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BookingStateMachineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-09T08:00:00Z"), ZoneOffset.UTC);

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private ProviderRepository providerRepository;
    @Mock
    private BookingStateTransitionRepository transitionRepository;
    @Mock
    private CancellationChargeRepository cancellationChargeRepository;
    @Mock
    private AvailabilityCache availabilityCache;
    @Mock
    private BookingEventPublisher eventPublisher;

    private BookingStateMachine stateMachine;

    private final Provider provider = Provider.builder()
            .id(1L)
            .timezone("UTC")
            .active(true)
            .payoutAccountId("acct_123")
            .build();

    @BeforeEach
    void setUp() {
        CancellationPolicy policy = new CancellationPolicy(CLOCK);
        ReflectionTestUtils.setField(policy, "lateWindowHours", 24L);
        ReflectionTestUtils.setField(policy, "lateFeePercent", BigDecimal.valueOf(25));
        ReflectionTestUtils.setField(policy, "platformSharePercent", BigDecimal.TEN);
        stateMachine = new BookingStateMachine(bookingRepository, providerRepository, transitionRepository,
                cancellationChargeRepository, policy, availabilityCache, eventPublisher, CLOCK);
    }

    private Booking givenBooking(BookingStatus status, LocalDate date, LocalTime start) {
        Booking booking = Booking.builder()
                .id(10L)
                .providerId(1L)
                .customerId(5L)
                .bookingDate(date)
                .startTime(start)
                .endTime(start.plusHours(1))
                .status(status)
                .totalAmount(new BigDecimal("100.00"))
                .platformFee(new BigDecimal("10.00"))
                .providerPayout(new BigDecimal("90.00"))
                .confirmationCode("K7Q2ZP")
                .build();
        given(bookingRepository.findByIdForUpdate(10L)).willReturn(Optional.of(booking));
        given(providerRepository.findById(1L)).willReturn(Optional.of(provider));
        return booking;
    }

    private void givenSaveReturnsArgument() {
        given(bookingRepository.save(any(Booking.class))).willAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("PENDING -> CANCELLED writes exactly one transition record and charges no fee")
    void cancelPending() {
        givenBooking(BookingStatus.PENDING, LocalDate.of(2026, 3, 9), LocalTime.of(10, 0));
        givenSaveReturnsArgument();

        Booking result = stateMachine.cancel(10L, "customer:5", "Change of plans");

        assertThat(result.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(result.getCancelledBy()).isEqualTo("customer:5");
        assertThat(result.getCancellationReason()).isEqualTo("Change of plans");
        assertThat(result.getCancelledAt()).isEqualTo(LocalDateTime.of(2026, 3, 9, 8, 0));
        assertThat(result.getUpdatedAt()).isEqualTo(LocalDateTime.of(2026, 3, 9, 8, 0));
        assertThat(result.getCancellationFee()).isEqualByComparingTo("0.00");

        ArgumentCaptor<BookingStateTransition> captor = ArgumentCaptor.forClass(BookingStateTransition.class);
        verify(transitionRepository).save(captor.capture());
        assertThat(captor.getValue().getFromStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(captor.getValue().getToStatus()).isEqualTo(BookingStatus.CANCELLED);
        verify(cancellationChargeRepository, never()).save(any());
        verify(eventPublisher).publishBookingCancelled(result, BookingStatus.PENDING);
        verify(availabilityCache).evict(1L, LocalDate.of(2026, 3, 9));
    }

    @Test
    @DisplayName("late cancellation of a CONFIRMED booking records a 25% fee and a split charge")
    void cancelConfirmedLate() {
        givenBooking(BookingStatus.CONFIRMED, LocalDate.of(2026, 3, 9), LocalTime.of(18, 0));
        givenSaveReturnsArgument();

        Booking result = stateMachine.cancel(10L, "customer:5", "Sick");

        assertThat(result.getCancellationFee()).isEqualByComparingTo("25.00");
        ArgumentCaptor<CancellationCharge> captor = ArgumentCaptor.forClass(CancellationCharge.class);
        verify(cancellationChargeRepository).save(captor.capture());
        assertThat(captor.getValue().getPlatformShare()).isEqualByComparingTo("2.50");
        assertThat(captor.getValue().getProviderShare()).isEqualByComparingTo("22.50");
    }

    @Test
    @DisplayName("COMPLETED -> CANCELLED is rejected and nothing is written")
    void cancelCompletedRejected() {
        Booking booking = givenBooking(BookingStatus.COMPLETED, LocalDate.of(2026, 3, 6), LocalTime.of(10, 0));

        assertThatThrownBy(() -> stateMachine.cancel(10L, "customer:5", "too late"))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(ex -> {
                    InvalidTransitionException ite = (InvalidTransitionException) ex;
                    assertThat(ite.getCurrent()).isEqualTo(BookingStatus.COMPLETED);
                    assertThat(ite.getRequested()).isEqualTo(BookingStatus.CANCELLED);
                });
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        verify(bookingRepository, never()).save(any());
        verify(transitionRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("IN_PROGRESS -> COMPLETED stamps completion time and publishes payout eligibility")
    void complete() {
        givenBooking(BookingStatus.IN_PROGRESS, LocalDate.of(2026, 3, 9), LocalTime.of(6, 0));
        givenSaveReturnsArgument();

        Booking result = stateMachine.complete(10L, BookingStateMachine.SYSTEM);

        assertThat(result.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(result.getCompletedAt()).isEqualTo(LocalDateTime.of(2026, 3, 9, 8, 0));
        verify(eventPublisher).publishBookingCompleted(result, provider);
    }

    @Test
    @DisplayName("PENDING -> CONFIRMED publishes the confirmation event")
    void confirm() {
        givenBooking(BookingStatus.PENDING, LocalDate.of(2026, 3, 10), LocalTime.of(10, 0));
        givenSaveReturnsArgument();

        Booking result = stateMachine.confirm(10L, "payment-gateway");

        assertThat(result.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        verify(eventPublisher).publishBookingConfirmed(result);
    }

    @Test
    @DisplayName("CANCELLED -> REFUNDED publishes the refund event with the reason")
    void refund() {
        givenBooking(BookingStatus.CANCELLED, LocalDate.of(2026, 3, 10), LocalTime.of(10, 0));
        givenSaveReturnsArgument();

        Booking result = stateMachine.refund(10L, "support", "Goodwill");

        assertThat(result.getStatus()).isEqualTo(BookingStatus.REFUNDED);
        verify(eventPublisher).publishBookingRefunded(result, BookingStatus.CANCELLED, "Goodwill");
    }

    @Test
    @DisplayName("unknown booking is not found")
    void unknownBooking() {
        given(bookingRepository.findByIdForUpdate(99L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> stateMachine.confirm(99L, "api"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
