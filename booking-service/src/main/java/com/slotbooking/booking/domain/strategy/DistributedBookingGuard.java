package com.slotbooking.booking.domain.strategy;

import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.common.exception.ConflictException;
import com.slotbooking.common.exception.ResourceNotFoundException;
import com.slotbooking.common.exception.ServiceUnavailableException;
import com.slotbooking.common.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Serializes attempts per provider and date with a Redisson lock, which is finer grained
 * than the provider row lock. The transaction commits before the lock is released, so the
 * next holder always sees the committed booking.
 */
@Slf4j
@Component("distributed")
public class DistributedBookingGuard implements BookingGuard {

    private final ProviderRepository providerRepository;
    private final RedissonClient redissonClient;
    private final TransactionTemplate transactionTemplate;

    public DistributedBookingGuard(ProviderRepository providerRepository,
                                   RedissonClient redissonClient,
                                   PlatformTransactionManager transactionManager) {
        this.providerRepository = providerRepository;
        this.redissonClient = redissonClient;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public <T> T execute(Long providerId, LocalDate date, Function<Provider, T> work) {
        String lockKey = buildLockKey(providerId, date);
        RLock lock = redissonClient.getLock(lockKey);

        try {
            // Wait max 5 seconds, hold for 30 seconds
            boolean acquired = lock.tryLock(5, 30, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ConflictException(
                        "Another booking for this provider and date is in progress. Please retry.",
                        "BOOKING_IN_PROGRESS");
            }
            log.debug("Acquired distributed lock: {}", lockKey);

            return transactionTemplate.execute(status -> {
                Provider provider = providerRepository.findById(providerId)
                        .orElseThrow(() -> new ResourceNotFoundException("Provider", providerId));
                return work.apply(provider);
            });

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Booking interrupted while waiting for lock", e);
        } catch (RedisException e) {
            log.error("Distributed lock store unavailable for {}", lockKey, e);
            throw new ServiceUnavailableException("Booking lock store unavailable. Please retry.", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getGuardType() {
        return "DISTRIBUTED_LOCK";
    }

    private String buildLockKey(Long providerId, LocalDate date) {
        return Constants.LOCK_PREFIX + providerId + ":" + date;
    }
}
