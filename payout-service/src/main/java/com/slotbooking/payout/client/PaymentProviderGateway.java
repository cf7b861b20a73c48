package com.slotbooking.payout.client;

import com.slotbooking.payout.client.dto.CreateTransferRequest;
import com.slotbooking.payout.client.dto.TransferResponse;
import com.slotbooking.payout.domain.model.PayoutSchedule;
import com.slotbooking.payout.exception.PermanentProviderException;
import com.slotbooking.payout.exception.TransientProviderException;
import feign.FeignException;
import feign.RetryableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Sends payout transfers and turns every provider failure into either a
 * {@link TransientProviderException} or a {@link PermanentProviderException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentProviderGateway {

    private final PaymentProviderClient paymentProviderClient;

    @CircuitBreaker(name = "payment-provider", fallbackMethod = "handleTransferFailure")
    public TransferResponse transfer(PayoutSchedule payout) {
        CreateTransferRequest request = new CreateTransferRequest(
                toMinorUnits(payout.getNetPayout()),
                payout.getCurrency(),
                payout.getPayoutAccountId(),
                "booking_" + payout.getBookingId(),
                Map.of(
                        "payoutId", String.valueOf(payout.getId()),
                        "bookingId", String.valueOf(payout.getBookingId()),
                        "providerId", String.valueOf(payout.getProviderId())));

        log.info("Sending transfer for payout {} ({} {}) with key {}",
                payout.getId(), payout.getNetPayout(), payout.getCurrency(), payout.idempotencyKey());
        TransferResponse response = paymentProviderClient.createTransfer(payout.idempotencyKey(), request);
        if (response == null || response.id() == null || response.id().isBlank()) {
            throw new TransientProviderException("Payment provider returned no transfer id", null);
        }
        return response;
    }

    private TransferResponse handleTransferFailure(PayoutSchedule payout, Throwable ex) {
        throw classify(ex);
    }

    static RuntimeException classify(Throwable ex) {
        if (ex instanceof TransientProviderException || ex instanceof PermanentProviderException) {
            return (RuntimeException) ex;
        }
        if (ex instanceof CallNotPermittedException) {
            return new TransientProviderException("Payment provider circuit is open", ex);
        }
        if (ex instanceof RetryableException) {
            return new TransientProviderException("Payment provider unreachable: " + ex.getMessage(), ex);
        }
        if (ex instanceof FeignException fe && fe.status() > 0) {
            int status = fe.status();
            if (status == 429 || status >= 500) {
                return new TransientProviderException("Payment provider returned HTTP " + status, ex);
            }
            if (status >= 400) {
                return new PermanentProviderException(
                        "Payment provider rejected transfer with HTTP " + status + ": " + fe.contentUTF8(), ex);
            }
        }
        if (isIoOrTimeout(ex)) {
            return new TransientProviderException("Payment provider call failed: " + ex.getMessage(), ex);
        }
        return new PermanentProviderException("Unexpected payment provider failure: " + ex.getMessage(), ex);
    }

    private static boolean isIoOrTimeout(Throwable e) {
        if (e == null) return false;
        if (e instanceof IOException || e instanceof TimeoutException) return true;
        Throwable cause = e.getCause();
        if (cause != null && cause != e) return isIoOrTimeout(cause);
        return false;
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
    }
}
