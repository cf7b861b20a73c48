package com.slotbooking.payout.client;

import com.slotbooking.payout.client.dto.CreateTransferRequest;
import com.slotbooking.payout.client.dto.TransferResponse;
import com.slotbooking.payout.domain.model.PayoutSchedule;
import com.slotbooking.payout.exception.PermanentProviderException;
import com.slotbooking.payout.exception.TransientProviderException;
import feign.FeignException;
import feign.Request;
import feign.Response;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link PaymentProviderGateway}: the transfer request shape and the
 * transient/permanent classification of provider failures.
 */
@ExtendWith(MockitoExtension.class)
class PaymentProviderGatewayTest {

    @Mock
    private PaymentProviderClient client;

    @InjectMocks
    private PaymentProviderGateway gateway;

    private static FeignException httpError(int status) {
        Request request = Request.create(Request.HttpMethod.POST, "http://provider/v1/transfers",
                Map.of(), null, StandardCharsets.UTF_8, null);
        Response response = Response.builder()
                .status(status)
                .reason("status " + status)
                .request(request)
                .headers(Map.of())
                .body("{\"error\":\"x\"}", StandardCharsets.UTF_8)
                .build();
        return FeignException.errorStatus("PaymentProviderClient#createTransfer", response);
    }

    private static PayoutSchedule payout() {
        return PayoutSchedule.builder()
                .id(42L).bookingId(7L).providerId(3L).payoutAccountId("acct_123")
                .netPayout(new BigDecimal("90.5")).currency("usd").build();
    }

    @Test
    @DisplayName("transfer sends the net payout in cents under the payout's idempotency key")
    void transfer_requestShape() {
        given(client.createTransfer(eq("payout-42"), any()))
                .willReturn(new TransferResponse("tr_1", 9050, "usd", "acct_123", "paid"));

        TransferResponse response = gateway.transfer(payout());

        ArgumentCaptor<CreateTransferRequest> request = ArgumentCaptor.forClass(CreateTransferRequest.class);
        verify(client).createTransfer(eq("payout-42"), request.capture());
        assertThat(response.id()).isEqualTo("tr_1");
        assertThat(request.getValue().amount()).isEqualTo(9050L);
        assertThat(request.getValue().destination()).isEqualTo("acct_123");
        assertThat(request.getValue().transferGroup()).isEqualTo("booking_7");
        assertThat(request.getValue().metadata()).containsEntry("payoutId", "42");
    }

    @Test
    @DisplayName("a response without a transfer id is treated as transient")
    void transfer_missingId() {
        given(client.createTransfer(any(), any())).willReturn(new TransferResponse(null, 0, "usd", null, null));

        assertThatThrownBy(() -> gateway.transfer(payout())).isInstanceOf(TransientProviderException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {429, 500, 502, 503, 504})
    @DisplayName("rate limits and 5xx responses are retryable")
    void classify_retryableStatuses(int status) {
        assertThat(PaymentProviderGateway.classify(httpError(status))).isInstanceOf(TransientProviderException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 402, 403, 404, 422})
    @DisplayName("account and validation errors are permanent")
    void classify_permanentStatuses(int status) {
        assertThat(PaymentProviderGateway.classify(httpError(status))).isInstanceOf(PermanentProviderException.class);
    }

    @Test
    @DisplayName("timeouts and I/O errors are retryable, including when wrapped")
    void classify_ioAndTimeouts() {
        assertThat(PaymentProviderGateway.classify(new SocketTimeoutException("Read timed out")))
                .isInstanceOf(TransientProviderException.class);
        assertThat(PaymentProviderGateway.classify(new RuntimeException(new IOException("connection reset"))))
                .isInstanceOf(TransientProviderException.class);
    }

    @Test
    @DisplayName("an open circuit is retryable")
    void classify_openCircuit() {
        CallNotPermittedException open = CallNotPermittedException.createCallNotPermittedException(
                CircuitBreaker.ofDefaults("payment-provider"));

        assertThat(PaymentProviderGateway.classify(open)).isInstanceOf(TransientProviderException.class);
    }

    @Test
    @DisplayName("already classified exceptions pass through unchanged")
    void classify_passThrough() {
        TransientProviderException classified = new TransientProviderException("x", null);

        assertThat(PaymentProviderGateway.classify(classified)).isSameAs(classified);
    }

    @Test
    @DisplayName("amounts are converted to minor units with half-up rounding")
    void toMinorUnits() {
        assertThat(PaymentProviderGateway.toMinorUnits(new BigDecimal("12.345"))).isEqualTo(1235L);
        assertThat(PaymentProviderGateway.toMinorUnits(new BigDecimal("1"))).isEqualTo(100L);
    }
}
