package com.slotbooking.payout.exception;

import com.slotbooking.common.exception.BusinessException;

/**
 * Payment provider failure worth retrying: network error, timeout, rate limit, 5xx
 * or an open circuit.
 */
public class TransientProviderException extends BusinessException {

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause, "PROVIDER_TRANSIENT");
    }
}
