package com.slotbooking.booking.api.exception;

import com.slotbooking.booking.api.dto.InvalidTransitionResponse;
import com.slotbooking.booking.api.dto.SlotConflictResponse;
import com.slotbooking.booking.exception.InvalidTransitionException;
import com.slotbooking.booking.exception.SlotConflictException;
import com.slotbooking.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Booking-specific 409 bodies: the blocking booking with alternative slots, or the
 * current and requested states of a rejected transition.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    @ExceptionHandler(SlotConflictException.class)
    public ResponseEntity<BaseResponse<SlotConflictResponse>> handleSlotConflict(SlotConflictException ex) {
        log.warn("Slot conflict (blocking booking {}): {}", ex.getBlockingBookingId(), ex.getMessage());
        SlotConflictResponse body = new SlotConflictResponse(ex.getBlockingBookingId(), ex.getAlternatives());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), body));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<BaseResponse<InvalidTransitionResponse>> handleInvalidTransition(
            InvalidTransitionException ex) {
        log.warn("Rejected transition {} -> {}", ex.getCurrent(), ex.getRequested());
        InvalidTransitionResponse body = new InvalidTransitionResponse(
                ex.getCurrent(), ex.getRequested(), ex.getCurrent().allowedTargets());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), body));
    }
}
