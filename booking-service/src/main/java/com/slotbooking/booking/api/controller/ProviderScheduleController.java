package com.slotbooking.booking.api.controller;

import com.slotbooking.booking.api.dto.AvailabilityWindowRequest;
import com.slotbooking.booking.api.dto.AvailabilityWindowResponse;
import com.slotbooking.booking.api.dto.BlockedSlotRequest;
import com.slotbooking.booking.api.dto.BlockedSlotResponse;
import com.slotbooking.booking.api.dto.CreateProviderRequest;
import com.slotbooking.booking.api.dto.ProviderResponse;
import com.slotbooking.booking.domain.service.ProviderScheduleService;
import com.slotbooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/providers")
@RequiredArgsConstructor
public class ProviderScheduleController {

    private final ProviderScheduleService scheduleService;

    @PostMapping
    public ResponseEntity<BaseResponse<ProviderResponse>> registerProvider(
            @Valid @RequestBody CreateProviderRequest request) {
        ProviderResponse response = ProviderResponse.from(scheduleService.registerProvider(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Provider registered", response));
    }

    @GetMapping("/{providerId}")
    public ResponseEntity<BaseResponse<ProviderResponse>> getProvider(@PathVariable Long providerId) {
        return ResponseEntity.ok(BaseResponse.success(ProviderResponse.from(scheduleService.getProvider(providerId))));
    }

    @PutMapping("/{providerId}/active")
    public ResponseEntity<BaseResponse<ProviderResponse>> setActive(
            @PathVariable Long providerId, @RequestParam boolean active) {
        return ResponseEntity.ok(BaseResponse.success(
                ProviderResponse.from(scheduleService.setActive(providerId, active))));
    }

    @GetMapping("/{providerId}/availability-windows")
    public ResponseEntity<BaseResponse<List<AvailabilityWindowResponse>>> getWindows(@PathVariable Long providerId) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.getWindows(providerId).stream()
                .map(AvailabilityWindowResponse::from)
                .toList()));
    }

    @PutMapping("/{providerId}/availability-windows")
    public ResponseEntity<BaseResponse<List<AvailabilityWindowResponse>>> replaceWindows(
            @PathVariable Long providerId,
            @RequestBody List<AvailabilityWindowRequest> windows) {
        return ResponseEntity.ok(BaseResponse.success("Weekly schedule updated",
                scheduleService.replaceWindows(providerId, windows).stream()
                        .map(AvailabilityWindowResponse::from)
                        .toList()));
    }

    @GetMapping("/{providerId}/blocked-slots")
    public ResponseEntity<BaseResponse<List<BlockedSlotResponse>>> getBlockedSlots(
            @PathVariable Long providerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.getBlockedSlots(providerId, from, to).stream()
                .map(BlockedSlotResponse::from)
                .toList()));
    }

    @PostMapping("/{providerId}/blocked-slots")
    public ResponseEntity<BaseResponse<BlockedSlotResponse>> addBlockedSlot(
            @PathVariable Long providerId, @Valid @RequestBody BlockedSlotRequest request) {
        BlockedSlotResponse response = BlockedSlotResponse.from(scheduleService.addBlockedSlot(providerId, request));
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Blocked", response));
    }

    @DeleteMapping("/{providerId}/blocked-slots/{blockId}")
    public ResponseEntity<Void> removeBlockedSlot(@PathVariable Long providerId, @PathVariable Long blockId) {
        scheduleService.removeBlockedSlot(providerId, blockId);
        return ResponseEntity.noContent().build();
    }
}
