package com.slotbooking.booking.domain.strategy;

import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.common.exception.ConflictException;
import com.slotbooking.common.exception.ServiceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link DistributedBookingGuard}: the Redisson lock wraps the whole
 * transaction and is always released by its holder.
 */
@ExtendWith(MockitoExtension.class)
class DistributedBookingGuardTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 9);

    @Mock
    private ProviderRepository providerRepository;
    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RLock lock;
    @Mock
    private PlatformTransactionManager transactionManager;

    private DistributedBookingGuard guard;

    @BeforeEach
    void setUp() {
        guard = new DistributedBookingGuard(providerRepository, redissonClient, transactionManager);
        given(redissonClient.getLock("lock:provider:1:2026-03-09")).willReturn(lock);
    }

    @Test
    @DisplayName("execute runs the work with the provider inside the lock and releases it")
    void execute_success() throws Exception {
        // given
        Provider provider = Provider.builder().id(1L).timezone("UTC").active(true).build();
        given(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        given(providerRepository.findById(1L)).willReturn(Optional.of(provider));

        // when
        String result = guard.execute(1L, DATE, p -> "booked for " + p.getId());

        // then
        assertThat(result).isEqualTo("booked for 1");
        verify(transactionManager).commit(any());
        verify(lock).unlock();
    }

    @Test
    @DisplayName("lock not acquired within the wait time is a BOOKING_IN_PROGRESS conflict")
    void execute_lockBusy() throws Exception {
        given(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).willReturn(false);
        given(lock.isHeldByCurrentThread()).willReturn(false);
        AtomicBoolean ran = new AtomicBoolean();

        assertThatThrownBy(() -> guard.execute(1L, DATE, p -> ran.getAndSet(true)))
                .isInstanceOf(ConflictException.class)
                .extracting("errorCode").isEqualTo("BOOKING_IN_PROGRESS");
        assertThat(ran).isFalse();
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("Redis failure maps to service unavailable")
    void execute_redisDown() throws Exception {
        given(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).willThrow(new RedisException("connection refused"));
        given(lock.isHeldByCurrentThread()).willReturn(false);

        assertThatThrownBy(() -> guard.execute(1L, DATE, p -> p))
                .isInstanceOf(ServiceUnavailableException.class);
    }
}
