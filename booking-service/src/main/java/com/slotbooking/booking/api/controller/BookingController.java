package com.slotbooking.booking.api.controller;

import com.slotbooking.booking.api.dto.BookingActionRequest;
import com.slotbooking.booking.api.dto.BookingResponse;
import com.slotbooking.booking.api.dto.BookingTransitionResponse;
import com.slotbooking.booking.api.dto.CreateBookingRequest;
import com.slotbooking.booking.api.dto.TransitionRequest;
import com.slotbooking.booking.domain.service.BookingService;
import com.slotbooking.booking.domain.service.ProviderBookingStats;
import com.slotbooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Booking creation, lifecycle transitions and read side.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = bookingService.createBooking(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingById(id)));
    }

    @GetMapping("/code/{confirmationCode}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBookingByCode(@PathVariable String confirmationCode) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingByConfirmationCode(confirmationCode)));
    }

    @GetMapping("/customer/{customerId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookingsByCustomer(
            @PathVariable Long customerId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingsByCustomerId(customerId)));
    }

    @GetMapping("/provider/{providerId}/upcoming")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getUpcomingBookings(
            @PathVariable Long providerId,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getUpcomingBookings(providerId, limit)));
    }

    @GetMapping("/provider/{providerId}/stats")
    public ResponseEntity<BaseResponse<ProviderBookingStats>> getProviderStats(
            @PathVariable Long providerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getProviderStats(providerId, from, to)));
    }

    @PostMapping("/{id}/transitions")
    public ResponseEntity<BaseResponse<BookingResponse>> transition(
            @PathVariable Long id, @Valid @RequestBody TransitionRequest request) {
        BookingResponse response = bookingService.transition(id, request.status(), request.triggeredBy(), request.reason());
        return ResponseEntity.ok(BaseResponse.success("Booking is now " + response.status(), response));
    }

    @GetMapping("/{id}/transitions")
    public ResponseEntity<BaseResponse<List<BookingTransitionResponse>>> getTransitions(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getTransitions(id)));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<BaseResponse<BookingResponse>> confirm(
            @PathVariable Long id, @Valid @RequestBody(required = false) BookingActionRequest request) {
        return ok(bookingService.confirm(id, actor(request)));
    }

    @PostMapping("/{id}/payment-failed")
    public ResponseEntity<BaseResponse<BookingResponse>> paymentFailed(
            @PathVariable Long id, @Valid @RequestBody(required = false) BookingActionRequest request) {
        return ok(bookingService.markPaymentFailed(id, actor(request), reason(request)));
    }

    @PostMapping("/{id}/retry-payment")
    public ResponseEntity<BaseResponse<BookingResponse>> retryPayment(
            @PathVariable Long id, @Valid @RequestBody(required = false) BookingActionRequest request) {
        return ok(bookingService.retryPayment(id, actor(request)));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<BaseResponse<BookingResponse>> start(
            @PathVariable Long id, @Valid @RequestBody(required = false) BookingActionRequest request) {
        return ok(bookingService.start(id, actor(request)));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<BaseResponse<BookingResponse>> complete(
            @PathVariable Long id, @Valid @RequestBody(required = false) BookingActionRequest request) {
        return ok(bookingService.complete(id, actor(request)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancel(
            @PathVariable Long id, @Valid @RequestBody(required = false) BookingActionRequest request) {
        return ok(bookingService.cancel(id, actor(request), reason(request)));
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<BaseResponse<BookingResponse>> noShow(
            @PathVariable Long id, @Valid @RequestBody(required = false) BookingActionRequest request) {
        return ok(bookingService.markNoShow(id, actor(request)));
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<BaseResponse<BookingResponse>> refund(
            @PathVariable Long id, @Valid @RequestBody(required = false) BookingActionRequest request) {
        return ok(bookingService.refund(id, actor(request), reason(request)));
    }

    private static ResponseEntity<BaseResponse<BookingResponse>> ok(BookingResponse response) {
        return ResponseEntity.ok(BaseResponse.success("Booking is now " + response.status(), response));
    }

    private static String actor(BookingActionRequest request) {
        return request != null ? request.actor() : BookingActionRequest.DEFAULT_ACTOR;
    }

    private static String reason(BookingActionRequest request) {
        return request != null ? request.reason() : null;
    }
}
