package com.slotbooking.booking.api.controller;

import com.slotbooking.booking.api.dto.AcquireSlotLockRequest;
import com.slotbooking.booking.api.dto.SlotLockResponse;
import com.slotbooking.booking.domain.service.SlotLockResult;
import com.slotbooking.booking.domain.service.SlotLockService;
import com.slotbooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.UUID;

/**
 * Checkout holds. A contested slot answers 409 with alternatives in the body.
 */
@RestController
@RequestMapping("/api/v1/slot-locks")
@RequiredArgsConstructor
public class SlotLockController {

    private final SlotLockService slotLockService;

    @PostMapping
    public ResponseEntity<BaseResponse<SlotLockResponse>> acquire(@Valid @RequestBody AcquireSlotLockRequest request) {
        Duration ttl = request.ttlMinutes() != null ? Duration.ofMinutes(request.ttlMinutes()) : null;
        SlotLockResult result = slotLockService.acquire(request.providerId(), request.date(),
                request.startTime(), request.endTime(), request.sessionId(), ttl);
        SlotLockResponse body = SlotLockResponse.from(result);
        if (!result.acquired()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(BaseResponse.error("Slot is held by another session or unavailable", "SLOT_CONTESTED", body));
        }
        return ResponseEntity.ok(BaseResponse.success("Slot locked", body));
    }

    @DeleteMapping("/{lockId}")
    public ResponseEntity<Void> release(@PathVariable UUID lockId) {
        slotLockService.release(lockId);
        return ResponseEntity.noContent().build();
    }
}
