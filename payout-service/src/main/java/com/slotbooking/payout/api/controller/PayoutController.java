package com.slotbooking.payout.api.controller;

import com.slotbooking.common.dto.BaseResponse;
import com.slotbooking.common.util.Constants;
import com.slotbooking.payout.api.dto.ManualCompletionRequest;
import com.slotbooking.payout.api.dto.OperatorActionRequest;
import com.slotbooking.payout.api.dto.PayoutPageResponse;
import com.slotbooking.payout.api.dto.PayoutResponse;
import com.slotbooking.payout.api.dto.SchedulePayoutRequest;
import com.slotbooking.payout.domain.service.PayoutHealth;
import com.slotbooking.payout.domain.service.PayoutService;
import com.slotbooking.payout.domain.service.PayoutStats;
import com.slotbooking.payout.domain.service.SchedulePayoutCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Payout queries for provider earnings views, plus operator overrides.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payouts")
@RequiredArgsConstructor
public class PayoutController {

    private final PayoutService payoutService;

    @PostMapping
    public ResponseEntity<BaseResponse<PayoutResponse>> schedulePayout(@Valid @RequestBody SchedulePayoutRequest request) {
        log.info("Manual payout scheduling for booking {}", request.bookingId());
        var payout = payoutService.schedulePayout(new SchedulePayoutCommand(
                request.bookingId(), request.providerId(), request.payoutAccountId(),
                request.amount(), request.platformFee(), request.completedAt()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Payout scheduled", PayoutResponse.from(payout)));
    }

    @GetMapping("/health")
    public ResponseEntity<BaseResponse<PayoutHealth>> getSystemHealth() {
        return ResponseEntity.ok(BaseResponse.success(payoutService.getSystemPayoutHealth()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<PayoutResponse>> getPayout(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(PayoutResponse.from(payoutService.getPayout(id))));
    }

    @GetMapping("/booking/{bookingId}")
    public ResponseEntity<BaseResponse<PayoutResponse>> getBookingPayout(@PathVariable Long bookingId) {
        return ResponseEntity.ok(BaseResponse.success(PayoutResponse.from(payoutService.getBookingPayout(bookingId))));
    }

    @GetMapping("/provider/{providerId}")
    public ResponseEntity<BaseResponse<PayoutPageResponse>> getProviderHistory(
            @PathVariable Long providerId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + Constants.DEFAULT_PAGE_SIZE) int size) {
        return ResponseEntity.ok(BaseResponse.success(
                PayoutPageResponse.from(payoutService.getProviderPayoutHistory(providerId, page, size))));
    }

    @GetMapping("/provider/{providerId}/stats")
    public ResponseEntity<BaseResponse<PayoutStats>> getProviderStats(@PathVariable Long providerId) {
        return ResponseEntity.ok(BaseResponse.success(payoutService.getProviderStats(providerId)));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<BaseResponse<PayoutResponse>> completeManually(
            @PathVariable Long id, @Valid @RequestBody ManualCompletionRequest request) {
        var payout = payoutService.completeManually(id, request.externalTransactionId(),
                request.operator(), request.note());
        return ResponseEntity.ok(BaseResponse.success("Payout marked completed", PayoutResponse.from(payout)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<BaseResponse<PayoutResponse>> retryPayout(
            @PathVariable Long id, @Valid @RequestBody OperatorActionRequest request) {
        var payout = payoutService.retryPayout(id, request.operator());
        return ResponseEntity.ok(BaseResponse.success("Payout requeued", PayoutResponse.from(payout)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<PayoutResponse>> cancelPayout(
            @PathVariable Long id, @Valid @RequestBody OperatorActionRequest request) {
        String reason = request.reason() != null ? request.reason() : "Cancelled by " + request.operator();
        var payout = payoutService.cancelPayout(id, reason);
        return ResponseEntity.ok(BaseResponse.success("Payout cancelled", PayoutResponse.from(payout)));
    }
}
