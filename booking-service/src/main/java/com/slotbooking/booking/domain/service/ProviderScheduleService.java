package com.slotbooking.booking.domain.service;

import com.slotbooking.booking.api.dto.AvailabilityWindowRequest;
import com.slotbooking.booking.api.dto.BlockedSlotRequest;
import com.slotbooking.booking.api.dto.CreateProviderRequest;
import com.slotbooking.booking.domain.model.AvailabilityWindow;
import com.slotbooking.booking.domain.model.BlockedSlot;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.booking.domain.repository.AvailabilityWindowRepository;
import com.slotbooking.booking.domain.repository.BlockedSlotRepository;
import com.slotbooking.booking.domain.repository.ProviderRepository;
import com.slotbooking.common.exception.ResourceNotFoundException;
import com.slotbooking.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Provider registration, weekly windows and blocked dates.
 * Every change evicts the provider's cached availability after commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderScheduleService {

    private final ProviderRepository providerRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final BlockedSlotRepository blockedSlotRepository;
    private final AvailabilityCache availabilityCache;
    private final Clock clock;

    @Transactional
    public Provider registerProvider(CreateProviderRequest request) {
        String timezone = request.timezone() != null ? request.timezone() : "UTC";
        validateZone(timezone);
        LocalDateTime now = LocalDateTime.now(clock);
        Provider provider = providerRepository.save(Provider.builder()
                .displayName(request.displayName())
                .timezone(timezone)
                .payoutAccountId(request.payoutAccountId())
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Registered provider {} ({}) in {}", provider.getId(), provider.getDisplayName(), timezone);
        return provider;
    }

    @Transactional(readOnly = true)
    public Provider getProvider(Long providerId) {
        return providerRepository.findById(providerId)
                .orElseThrow(() -> new ResourceNotFoundException("Provider", providerId));
    }

    @Transactional
    public Provider setActive(Long providerId, boolean active) {
        Provider provider = getProvider(providerId);
        provider.setActive(active);
        provider.setUpdatedAt(LocalDateTime.now(clock));
        availabilityCache.evictProvider(providerId);
        log.info("Provider {} is now {}", providerId, active ? "active" : "inactive");
        return providerRepository.save(provider);
    }

    @Transactional(readOnly = true)
    public List<AvailabilityWindow> getWindows(Long providerId) {
        getProvider(providerId);
        return windowRepository.findByProviderIdOrderByDayOfWeekAscStartTimeAsc(providerId);
    }

    /**
     * Replaces the whole weekly schedule. Windows on the same day may overlap; each is
     * sliced into slots on its own.
     */
    @Transactional
    public List<AvailabilityWindow> replaceWindows(Long providerId, List<AvailabilityWindowRequest> requests) {
        getProvider(providerId);
        for (AvailabilityWindowRequest r : requests) {
            if (r.dayOfWeek() == null) {
                throw new ValidationException("Day of week cannot be null");
            }
            requireOrdered(r.startTime(), r.endTime());
        }

        windowRepository.deleteByProviderId(providerId);
        List<AvailabilityWindow> windows = windowRepository.saveAll(requests.stream()
                .map(r -> AvailabilityWindow.builder()
                        .providerId(providerId)
                        .dayOfWeek(r.dayOfWeek())
                        .startTime(r.startTime())
                        .endTime(r.endTime())
                        .active(r.active() == null || r.active())
                        .build())
                .toList());
        availabilityCache.evictProvider(providerId);
        log.info("Replaced weekly schedule of provider {} with {} window(s)", providerId, windows.size());
        return windows;
    }

    @Transactional
    public BlockedSlot addBlockedSlot(Long providerId, BlockedSlotRequest request) {
        getProvider(providerId);
        if ((request.startTime() == null) != (request.endTime() == null)) {
            throw new ValidationException("Partial blocks need both start and end time; omit both to block the whole day");
        }
        if (request.startTime() != null) {
            requireOrdered(request.startTime(), request.endTime());
        }
        BlockedSlot block = blockedSlotRepository.save(BlockedSlot.builder()
                .providerId(providerId)
                .blockedDate(request.date())
                .startTime(request.startTime())
                .endTime(request.endTime())
                .reason(request.reason())
                .createdAt(LocalDateTime.now(clock))
                .build());
        availabilityCache.evict(providerId, request.date());
        log.info("Provider {} blocked {} {}", providerId, request.date(),
                block.isFullDay() ? "(full day)" : block.getStartTime() + "-" + block.getEndTime());
        return block;
    }

    @Transactional(readOnly = true)
    public List<BlockedSlot> getBlockedSlots(Long providerId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new ValidationException("Range end must not be before its start");
        }
        return blockedSlotRepository.findByProviderIdAndBlockedDateBetweenOrderByBlockedDateAsc(providerId, from, to);
    }

    @Transactional
    public void removeBlockedSlot(Long providerId, Long blockId) {
        BlockedSlot block = blockedSlotRepository.findByIdAndProviderId(blockId, providerId)
                .orElseThrow(() -> new ResourceNotFoundException("BlockedSlot", blockId));
        blockedSlotRepository.delete(block);
        availabilityCache.evict(providerId, block.getBlockedDate());
        log.info("Provider {} removed block {} on {}", providerId, blockId, block.getBlockedDate());
    }

    private void requireOrdered(LocalTime start, LocalTime end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ValidationException("Start time must be before end time");
        }
    }

    private void validateZone(String timezone) {
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone: " + timezone);
        }
    }
}
