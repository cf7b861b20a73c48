package com.slotbooking.booking.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotbooking.booking.domain.availability.TimeSlot;
import com.slotbooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis read-through cache of computed slots, one hash per provider and date keyed by
 * slot duration. A per-provider set indexes the cached date keys so a schedule change
 * can evict every cached date, however far ahead. May lag the database; the booking
 * coordinator never reads it. All Redis failures degrade to a cache miss.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityCache {

    private static final TypeReference<List<TimeSlot>> SLOT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${booking.availability.cache-enabled:true}")
    private boolean cacheEnabled;

    @Value("${booking.availability.cache-ttl-minutes:15}")
    private int cacheTtlMinutes;

    public Optional<List<TimeSlot>> get(Long providerId, LocalDate date, int durationMinutes) {
        if (!isEnabled()) return Optional.empty();
        try {
            Object json = stringRedisTemplate.opsForHash().get(key(providerId, date), String.valueOf(durationMinutes));
            if (json == null) {
                return Optional.empty();
            }
            log.debug("Availability cache hit for provider {} on {} ({} min)", providerId, date, durationMinutes);
            return Optional.of(objectMapper.readValue(json.toString(), SLOT_LIST));
        } catch (Exception e) {
            log.debug("Availability cache read failed, computing from DB: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void put(Long providerId, LocalDate date, int durationMinutes, List<TimeSlot> slots) {
        if (!isEnabled()) return;
        try {
            String key = key(providerId, date);
            String index = indexKey(providerId);
            Duration ttl = Duration.ofMinutes(cacheTtlMinutes);
            stringRedisTemplate.opsForHash().put(key, String.valueOf(durationMinutes), objectMapper.writeValueAsString(slots));
            stringRedisTemplate.expire(key, ttl);
            stringRedisTemplate.opsForSet().add(index, key);
            stringRedisTemplate.expire(index, ttl);
        } catch (Exception e) {
            log.warn("Failed to write availability cache for provider {} on {} (non-fatal)", providerId, date, e);
        }
    }

    /**
     * Evicts one provider/date. Inside a transaction the eviction runs after commit so a
     * concurrent reader cannot repopulate the cache with pre-commit state.
     */
    public void evict(Long providerId, LocalDate date) {
        runAfterCommit(() -> delete(List.of(key(providerId, date))));
    }

    /** Evicts every cached date of a provider, used after schedule changes. */
    public void evictProvider(Long providerId) {
        runAfterCommit(() -> {
            if (!isEnabled()) return;
            String index = indexKey(providerId);
            try {
                Set<String> cached = stringRedisTemplate.opsForSet().members(index);
                List<String> keys = new ArrayList<>();
                if (cached != null) {
                    keys.addAll(cached);
                }
                keys.add(index);
                delete(keys);
            } catch (Exception e) {
                log.warn("Failed to read cached dates of provider {} (entries expire after {} min)",
                        providerId, cacheTtlMinutes, e);
            }
        });
    }

    private void delete(List<String> keys) {
        if (!isEnabled()) return;
        try {
            stringRedisTemplate.delete(keys);
            log.debug("Evicted availability cache keys {}", keys.size() == 1 ? keys.get(0) : keys.size() + " keys");
        } catch (Exception e) {
            log.warn("Failed to evict availability cache {} (entries expire after {} min)", keys.get(0), cacheTtlMinutes, e);
        }
    }

    private void runAfterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }

    private boolean isEnabled() {
        return cacheEnabled && stringRedisTemplate != null;
    }

    static String key(Long providerId, LocalDate date) {
        return Constants.CACHE_AVAILABILITY_PREFIX + providerId + ":" + date;
    }

    static String indexKey(Long providerId) {
        return Constants.CACHE_AVAILABILITY_PREFIX + providerId + ":dates";
    }
}
