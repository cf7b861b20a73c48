package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.domain.availability.TimeSlot;
import com.slotbooking.booking.domain.model.SlotLock;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.booking.domain.repository.SlotLockRepository;
import com.slotbooking.common.exception.ResourceNotFoundException;
import com.slotbooking.common.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link SlotLockService}: acquisition outcomes are decided by the rows
 * affected by the upsert, never by in-memory state.
 */
@ExtendWith(MockitoExtension.class)
class SlotLockServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 8, 0);
    private static final Long PROVIDER_ID = 1L;
    private static final LocalDate DATE = LocalDate.of(2026, 3, 9);
    private static final LocalTime START = LocalTime.of(10, 0);
    private static final LocalTime END = LocalTime.of(11, 0);

    @Mock
    private SlotLockRepository slotLockRepository;
    @Mock
    private ProviderRepository providerRepository;
    @Mock
    private AvailabilityService availabilityService;
    @Mock
    private AvailabilityCache availabilityCache;

    private SlotLockService service;

    @BeforeEach
    void setUp() {
        service = new SlotLockService(slotLockRepository, providerRepository, availabilityService, availabilityCache, CLOCK);
        ReflectionTestUtils.setField(service, "defaultTtlMinutes", 10);
        ReflectionTestUtils.setField(service, "maxTtlMinutes", 60);
    }

    private void givenFreeSlot() {
        given(providerRepository.existsById(PROVIDER_ID)).willReturn(true);
        given(availabilityService.isSlotAvailable(PROVIDER_ID, DATE, START, END)).willReturn(true);
        given(slotLockRepository.findActiveOverlappingHeldByOthers(PROVIDER_ID, DATE, START, END, "session-a", NOW))
                .willReturn(List.of());
    }

    @Test
    @DisplayName("acquire with default ttl locks the slot for 10 minutes")
    void acquire_success() {
        // given
        givenFreeSlot();
        UUID lockId = UUID.randomUUID();
        LocalDateTime until = NOW.plusMinutes(10);
        given(slotLockRepository.tryAcquire(any(UUID.class), eq(PROVIDER_ID), eq(DATE), eq(START), eq(END),
                eq("session-a"), eq(until), eq(NOW))).willReturn(1);
        given(slotLockRepository.findByProviderIdAndSlotDateAndStartTimeAndEndTime(PROVIDER_ID, DATE, START, END))
                .willReturn(Optional.of(SlotLock.builder()
                        .id(lockId)
                        .providerId(PROVIDER_ID)
                        .slotDate(DATE)
                        .startTime(START)
                        .endTime(END)
                        .sessionId("session-a")
                        .lockedUntil(until)
                        .build()));

        // when
        SlotLockResult result = service.acquire(PROVIDER_ID, DATE, START, END, "session-a", null);

        // then
        assertThat(result.acquired()).isTrue();
        assertThat(result.lockId()).isEqualTo(lockId);
        assertThat(result.lockedUntil()).isEqualTo(until);
        verify(availabilityCache).evict(PROVIDER_ID, DATE);
    }

    @Test
    @DisplayName("acquire returns contested with alternatives when the upsert affects no row")
    void acquire_contested_whenUpsertLoses() {
        givenFreeSlot();
        given(slotLockRepository.tryAcquire(any(UUID.class), eq(PROVIDER_ID), eq(DATE), eq(START), eq(END),
                eq("session-a"), any(LocalDateTime.class), eq(NOW))).willReturn(0);
        TimeSlot alternative = new TimeSlot(DATE, LocalTime.of(11, 0), LocalTime.of(12, 0), true, null);
        given(availabilityService.findAlternativeSlots(PROVIDER_ID, DATE, 60, START, END))
                .willReturn(List.of(alternative));

        SlotLockResult result = service.acquire(PROVIDER_ID, DATE, START, END, "session-a", Duration.ofMinutes(5));

        assertThat(result.acquired()).isFalse();
        assertThat(result.lockId()).isNull();
        assertThat(result.alternatives()).containsExactly(alternative);
        verify(availabilityCache, never()).evict(any(), any());
    }

    @Test
    @DisplayName("an overlapping live lock of another session makes the slot contested")
    void acquire_contested_whenOverlappingLockHeld() {
        given(providerRepository.existsById(PROVIDER_ID)).willReturn(true);
        given(availabilityService.isSlotAvailable(PROVIDER_ID, DATE, START, END)).willReturn(true);
        given(slotLockRepository.findActiveOverlappingHeldByOthers(PROVIDER_ID, DATE, START, END, "session-a", NOW))
                .willReturn(List.of(SlotLock.builder()
                        .providerId(PROVIDER_ID)
                        .slotDate(DATE)
                        .startTime(LocalTime.of(10, 30))
                        .endTime(LocalTime.of(11, 30))
                        .sessionId("session-b")
                        .lockedUntil(NOW.plusMinutes(3))
                        .build()));
        given(availabilityService.findAlternativeSlots(PROVIDER_ID, DATE, 60, START, END)).willReturn(List.of());

        SlotLockResult result = service.acquire(PROVIDER_ID, DATE, START, END, "session-a", null);

        assertThat(result.acquired()).isFalse();
        verify(slotLockRepository, never()).tryAcquire(any(), any(), any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("a booked or blocked slot cannot be locked")
    void acquire_contested_whenSlotUnavailable() {
        given(providerRepository.existsById(PROVIDER_ID)).willReturn(true);
        given(availabilityService.isSlotAvailable(PROVIDER_ID, DATE, START, END)).willReturn(false);
        given(availabilityService.findAlternativeSlots(PROVIDER_ID, DATE, 60, START, END)).willReturn(List.of());

        SlotLockResult result = service.acquire(PROVIDER_ID, DATE, START, END, "session-a", null);

        assertThat(result.acquired()).isFalse();
    }

    @Test
    @DisplayName("ttl above the maximum is rejected")
    void acquire_ttlTooLong() {
        assertThatThrownBy(() -> service.acquire(PROVIDER_ID, DATE, START, END, "session-a", Duration.ofHours(2)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("unknown provider is not found")
    void acquire_unknownProvider() {
        given(providerRepository.existsById(PROVIDER_ID)).willReturn(false);

        assertThatThrownBy(() -> service.acquire(PROVIDER_ID, DATE, START, END, "session-a", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("release of an unknown lock is a no-op")
    void release_unknownLock() {
        UUID lockId = UUID.randomUUID();
        given(slotLockRepository.findById(lockId)).willReturn(Optional.empty());

        service.release(lockId);

        verify(slotLockRepository, never()).deleteLock(any());
        verify(availabilityCache, never()).evict(any(), any());
    }

    @Test
    @DisplayName("sweep deletes expired locks and evicts each affected provider date once")
    void releaseExpiredLocks() {
        SlotLock a = SlotLock.builder().providerId(PROVIDER_ID).slotDate(DATE)
                .startTime(START).endTime(END).lockedUntil(NOW.minusMinutes(1)).build();
        SlotLock b = SlotLock.builder().providerId(PROVIDER_ID).slotDate(DATE)
                .startTime(END).endTime(END.plusHours(1)).lockedUntil(NOW.minusMinutes(2)).build();
        given(slotLockRepository.findExpired(NOW)).willReturn(List.of(a, b));
        given(slotLockRepository.deleteExpired(NOW)).willReturn(2);

        service.releaseExpiredLocks();

        verify(slotLockRepository).deleteExpired(NOW);
        verify(availabilityCache).evict(PROVIDER_ID, DATE);
    }
}
