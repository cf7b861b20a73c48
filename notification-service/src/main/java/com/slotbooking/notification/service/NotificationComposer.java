package com.slotbooking.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotbooking.common.util.Constants;
import com.slotbooking.notification.domain.model.Notification;
import com.slotbooking.notification.domain.model.Notification.Audience;
import com.slotbooking.notification.domain.model.Notification.NotificationStatus;
import com.slotbooking.notification.domain.model.Notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a booking or payout event into the notifications it should produce.
 *
 * Guests are reached by email, registered customers and providers by push to their
 * account; operator alerts go to {@code notification.operator-recipient}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationComposer {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${notification.operator-recipient:payout-ops@slotbooking.local}")
    private String operatorRecipient;

    public List<Notification> compose(String topic, JsonNode event) {
        List<Notification> result = new ArrayList<>();
        switch (topic) {
            case Constants.TOPIC_BOOKING_CONFIRMED -> {
                String when = when(event);
                result.add(toCustomer(topic, event, "Booking confirmed",
                        "Your booking " + text(event, "confirmationCode") + " on " + when + " is confirmed."));
                result.add(toProvider(topic, event, "New booking",
                        "Booking " + text(event, "confirmationCode") + " on " + when + " has been confirmed."));
            }
            case Constants.TOPIC_BOOKING_CANCELLED -> {
                BigDecimal fee = decimal(event, "cancellationFee");
                String feeLine = fee != null && fee.signum() > 0
                        ? " A late cancellation fee of " + fee + " applies." : "";
                String when = when(event);
                result.add(toCustomer(topic, event, "Booking cancelled",
                        "Your booking " + text(event, "confirmationCode") + " on " + when + " was cancelled." + feeLine));
                result.add(toProvider(topic, event, "Booking cancelled",
                        "Booking " + text(event, "confirmationCode") + " on " + when + " was cancelled by "
                                + text(event, "cancelledBy") + "."));
            }
            case Constants.TOPIC_BOOKING_COMPLETED -> result.add(toCustomer(topic, event, "Thanks for your visit",
                    "Your booking is complete. We hope to see you again soon!"));
            case Constants.TOPIC_PAYOUT_COMPLETED -> result.add(toProvider(topic, event, "Payout sent",
                    "A payout of " + decimal(event, "netPayout") + " " + upper(text(event, "currency"))
                            + " for booking " + longValue(event, "bookingId") + " is on its way."));
            case Constants.TOPIC_PAYOUT_FAILED -> result.add(base(topic, event, Audience.OPERATOR)
                    .type(NotificationType.EMAIL)
                    .recipient(operatorRecipient)
                    .subject("Payout " + longValue(event, "payoutId") + " failed: action required")
                    .body("Payout " + longValue(event, "payoutId") + " for booking " + longValue(event, "bookingId")
                            + " (provider " + longValue(event, "providerId") + ", " + decimal(event, "netPayout")
                            + " " + upper(text(event, "currency")) + ") failed after "
                            + event.path("retryCount").asInt() + " retries: " + text(event, "failureReason"))
                    .build());
            default -> log.warn("No notifications defined for topic {}", topic);
        }
        return result;
    }

    private Notification toCustomer(String topic, JsonNode event, String subject, String body) {
        Long customerId = longValue(event, "customerId");
        String guestEmail = text(event, "guestEmail");
        boolean guest = guestEmail != null && !guestEmail.isBlank();
        return base(topic, event, Audience.CUSTOMER)
                .type(guest ? NotificationType.EMAIL : NotificationType.PUSH)
                .recipient(guest ? guestEmail : customerId != null ? "customer:" + customerId : null)
                .subject(subject)
                .body(body)
                .build();
    }

    private Notification toProvider(String topic, JsonNode event, String subject, String body) {
        Long providerId = longValue(event, "providerId");
        return base(topic, event, Audience.PROVIDER)
                .type(NotificationType.PUSH)
                .recipient(providerId != null ? "provider:" + providerId : null)
                .subject(subject)
                .body(body)
                .build();
    }

    private Notification.NotificationBuilder base(String topic, JsonNode event, Audience audience) {
        return Notification.builder()
                .eventType(topic)
                .audience(audience)
                .bookingId(longValue(event, "bookingId"))
                .customerId(longValue(event, "customerId"))
                .providerId(longValue(event, "providerId"))
                .payoutId(longValue(event, "payoutId"))
                .status(NotificationStatus.PENDING)
                .createdAt(LocalDateTime.now(clock));
    }

    private String when(JsonNode event) {
        LocalDate date = convert(event.get("bookingDate"), LocalDate.class);
        LocalTime start = convert(event.get("startTime"), LocalTime.class);
        if (date == null) return "your booked date";
        return start != null ? date + " at " + start : date.toString();
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) return null;
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            log.warn("Cannot read {} from {}", type.getSimpleName(), node);
            return null;
        }
    }

    private static String text(JsonNode event, String field) {
        JsonNode node = event.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Long longValue(JsonNode event, String field) {
        JsonNode node = event.get(field);
        return node == null || node.isNull() ? null : node.asLong();
    }

    private static BigDecimal decimal(JsonNode event, String field) {
        JsonNode node = event.get(field);
        return node == null || node.isNull() ? null : node.decimalValue().setScale(2, RoundingMode.HALF_UP);
    }

    private static String upper(String value) {
        return value == null ? "" : value.toUpperCase();
    }
}
