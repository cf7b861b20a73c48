package com.slotbooking.payout.client;

import com.slotbooking.payout.client.dto.CreateTransferRequest;
import com.slotbooking.payout.client.dto.TransferResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

/**
 * Feign client for the external payment provider's transfer API.
 * Timeouts are configured under {@code spring.cloud.openfeign.client.config.payment-provider}.
 */
@FeignClient(name = "payment-provider", url = "${payout.provider.url}", path = "/v1")
public interface PaymentProviderClient {

    @PostMapping("/transfers")
    TransferResponse createTransfer(@RequestHeader("Idempotency-Key") String idempotencyKey,
                                    @RequestBody CreateTransferRequest request);
}
