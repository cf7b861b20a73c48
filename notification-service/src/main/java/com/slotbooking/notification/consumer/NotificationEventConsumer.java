package com.slotbooking.notification.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotbooking.common.util.Constants;
import com.slotbooking.notification.domain.model.Notification;
import com.slotbooking.notification.domain.repository.NotificationRepository;
import com.slotbooking.notification.service.NotificationComposer;
import com.slotbooking.notification.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Kafka consumer for booking and payout events.
 *
 * Listens to:
 * - booking-confirmed, booking-cancelled: customer and provider
 * - booking-completed: customer
 * - payout-completed: provider
 * - payout-failed: operator alert
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationEventConsumer {

    private final NotificationComposer composer;
    private final NotificationService notificationService;
    private final NotificationRepository notificationRepository;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = {
            Constants.TOPIC_BOOKING_CONFIRMED,
            Constants.TOPIC_BOOKING_CANCELLED,
            Constants.TOPIC_BOOKING_COMPLETED,
            Constants.TOPIC_PAYOUT_COMPLETED,
            Constants.TOPIC_PAYOUT_FAILED
    }, groupId = "${spring.kafka.consumer.group-id:notification-service}")
    public void handle(ConsumerRecord<String, String> record) {
        handleEvent(record.topic(), record.value());
    }

    void handleEvent(String topic, String payload) {
        log.info("Received {} event: {}", topic, payload);

        JsonNode event;
        try {
            event = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.error("Skipping unreadable {} payload: {}", topic, payload, e);
            return;
        }

        List<Notification> notifications = composer.compose(topic, event);
        for (Notification notification : notifications) {
            Notification saved = notificationRepository.save(notification);
            notificationService.send(saved);
        }
        log.info("Processed {} event: {} notification(s)", topic, notifications.size());
    }
}
