package com.slotbooking.common.exception;

/**
 * Request is well-formed JSON but violates a booking rule: out-of-hours range,
 * blocked date, malformed time range, amount below a minimum.
 * Mapped to HTTP 400.
 */
public class ValidationException extends BusinessException {

    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }

    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
