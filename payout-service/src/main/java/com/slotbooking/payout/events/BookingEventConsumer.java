package com.slotbooking.payout.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotbooking.common.exception.ConflictException;
import com.slotbooking.common.exception.ValidationException;
import com.slotbooking.common.util.Constants;
import com.slotbooking.payout.domain.service.PayoutService;
import com.slotbooking.payout.domain.service.SchedulePayoutCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for booking events that affect payouts.
 *
 * Listens to:
 * - booking-completed: schedules the payout
 * - booking-refunded: cancels a payout that has not started
 *
 * Redelivered events are harmless: a second schedule for the same booking is a conflict
 * and is ignored. Infrastructure failures propagate so the container redelivers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventConsumer {

    private final PayoutService payoutService;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = Constants.TOPIC_BOOKING_COMPLETED, groupId = "${spring.kafka.consumer.group-id:payout-service}")
    public void handleBookingCompleted(String payload) {
        BookingCompletedEvent event = read(payload, BookingCompletedEvent.class);
        if (event == null) return;
        log.info("Received booking completed event for booking {}", event.getBookingId());

        try {
            payoutService.schedulePayout(new SchedulePayoutCommand(
                    event.getBookingId(),
                    event.getProviderId(),
                    event.getPayoutAccountId(),
                    event.getTotalAmount(),
                    event.getPlatformFee(),
                    event.getCompletedAt()));
        } catch (ConflictException e) {
            log.info("Payout for booking {} already scheduled, ignoring redelivery", event.getBookingId());
        } catch (ValidationException e) {
            log.warn("Payout not scheduled for booking {}: {}", event.getBookingId(), e.getMessage());
        }
    }

    @KafkaListener(topics = Constants.TOPIC_BOOKING_REFUNDED, groupId = "${spring.kafka.consumer.group-id:payout-service}")
    public void handleBookingRefunded(String payload) {
        BookingRefundedEvent event = read(payload, BookingRefundedEvent.class);
        if (event == null) return;
        log.info("Received booking refunded event for booking {} (was {})",
                event.getBookingId(), event.getPreviousStatus());
        payoutService.cancelForBooking(event.getBookingId(), event.getReason());
    }

    private <T> T read(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            log.error("Skipping unreadable {} payload: {}", type.getSimpleName(), payload, e);
            return null;
        }
    }
}
