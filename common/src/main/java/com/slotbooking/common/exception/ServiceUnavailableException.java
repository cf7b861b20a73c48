package com.slotbooking.common.exception;

/**
 * Thrown when a collaborator the request depends on (distributed lock store,
 * payment provider) cannot be reached. The caller may retry the same request.
 * Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
