package com.slotbooking.booking.api.controller;

import com.slotbooking.booking.domain.availability.ProviderAvailability;
import com.slotbooking.booking.domain.availability.TimeSlot;
import com.slotbooking.booking.domain.service.AvailabilityService;
import com.slotbooking.common.dto.BaseResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/providers/{providerId}")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @GetMapping("/availability")
    public ResponseEntity<BaseResponse<ProviderAvailability>> getAvailability(
            @PathVariable Long providerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) Integer duration,
            @RequestParam(required = false) String timezone) {
        return ResponseEntity.ok(BaseResponse.success(
                availabilityService.getAvailability(providerId, from, to, duration, timezone)));
    }

    @GetMapping("/alternatives")
    public ResponseEntity<BaseResponse<List<TimeSlot>>> getAlternatives(
            @PathVariable Long providerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam int duration,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime excludeStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime excludeEnd) {
        return ResponseEntity.ok(BaseResponse.success(
                availabilityService.findAlternativeSlots(providerId, date, duration, excludeStart, excludeEnd)));
    }
}
