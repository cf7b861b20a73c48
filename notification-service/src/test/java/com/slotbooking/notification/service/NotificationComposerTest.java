package com.slotbooking.notification.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.slotbooking.notification.domain.model.Notification;
import com.slotbooking.notification.domain.model.Notification.Audience;
import com.slotbooking.notification.domain.model.Notification.NotificationStatus;
import com.slotbooking.notification.domain.model.Notification.NotificationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationComposerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private NotificationComposer composer;

    @BeforeEach
    void setUp() {
        composer = new NotificationComposer(objectMapper,
                Clock.fixed(Instant.parse("2026-03-09T08:00:00Z"), ZoneOffset.UTC));
        ReflectionTestUtils.setField(composer, "operatorRecipient", "ops@example.com");
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }

    @Test
    @DisplayName("booking-confirmed for a guest emails the guest and pushes to the provider")
    void bookingConfirmed_guest() throws Exception {
        List<Notification> result = composer.compose("booking-confirmed", json("""
                {"bookingId":5,"providerId":3,"guestEmail":"guest@example.com","confirmationCode":"AB12CD",
                 "bookingDate":[2026,3,10],"startTime":[14,0],"totalAmount":80.00}
                """));

        assertThat(result).hasSize(2);
        Notification customer = result.get(0);
        assertThat(customer.getAudience()).isEqualTo(Audience.CUSTOMER);
        assertThat(customer.getType()).isEqualTo(NotificationType.EMAIL);
        assertThat(customer.getRecipient()).isEqualTo("guest@example.com");
        assertThat(customer.getBody()).contains("AB12CD").contains("2026-03-10 at 14:00");
        assertThat(customer.getStatus()).isEqualTo(NotificationStatus.PENDING);
        assertThat(result.get(1).getRecipient()).isEqualTo("provider:3");
    }

    @Test
    @DisplayName("booking-cancelled mentions the late cancellation fee when one applies")
    void bookingCancelled_withFee() throws Exception {
        List<Notification> result = composer.compose("booking-cancelled", json("""
                {"bookingId":5,"providerId":3,"customerId":11,"confirmationCode":"AB12CD",
                 "bookingDate":"2026-03-10","startTime":"14:00:00","cancelledBy":"customer",
                 "cancellationFee":20.00}
                """));

        Notification customer = result.get(0);
        assertThat(customer.getType()).isEqualTo(NotificationType.PUSH);
        assertThat(customer.getRecipient()).isEqualTo("customer:11");
        assertThat(customer.getBody()).contains("late cancellation fee of 20.00");
    }

    @Test
    @DisplayName("payout-failed produces a single operator alert")
    void payoutFailed_alertsOperator() throws Exception {
        List<Notification> result = composer.compose("payout-failed", json("""
                {"payoutId":42,"bookingId":7,"providerId":3,"netPayout":90.00,"currency":"usd",
                 "retryCount":3,"permanent":false,"failureReason":"HTTP 503 (max retries exceeded)"}
                """));

        assertThat(result).singleElement().satisfies(n -> {
            assertThat(n.getAudience()).isEqualTo(Audience.OPERATOR);
            assertThat(n.getRecipient()).isEqualTo("ops@example.com");
            assertThat(n.getPayoutId()).isEqualTo(42L);
            assertThat(n.getBody()).contains("USD").contains("after 3 retries").contains("max retries exceeded");
        });
    }

    @Test
    @DisplayName("unknown topics produce nothing")
    void unknownTopic() throws Exception {
        assertThat(composer.compose("booking-refunded", json("{\"bookingId\":5}"))).isEmpty();
    }
}
