package com.slotbooking.payout.exception;

import com.slotbooking.common.exception.BusinessException;

/**
 * Payment provider rejected the transfer (bad account, validation error). Retrying
 * with the same input cannot succeed.
 */
public class PermanentProviderException extends BusinessException {

    public PermanentProviderException(String message, Throwable cause) {
        super(message, cause, "PROVIDER_PERMANENT");
    }
}
