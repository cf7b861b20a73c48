package com.slotbooking.common.exception;

/**
 * The requested change collides with existing state (slot already booked,
 * payout already scheduled). Mapped to HTTP 409.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message) {
        super(message, "CONFLICT");
    }

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
