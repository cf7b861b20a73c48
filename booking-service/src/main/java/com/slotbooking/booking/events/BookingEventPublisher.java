package com.slotbooking.booking.events;

import com.slotbooking.booking.domain.model.Booking;
import com.slotbooking.booking.domain.model.BookingStatus;
import com.slotbooking.booking.domain.model.Provider;
import com.slotbooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for booking lifecycle events, keyed by booking id.
 *
 * Events are sent after the surrounding transaction commits, so consumers never see a
 * status that was rolled back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publishBookingConfirmed(Booking booking) {
        BookingConfirmedEvent event = BookingConfirmedEvent.builder()
                .bookingId(booking.getId())
                .providerId(booking.getProviderId())
                .customerId(booking.getCustomerId())
                .guestEmail(booking.getGuestEmail())
                .confirmationCode(booking.getConfirmationCode())
                .bookingDate(booking.getBookingDate())
                .startTime(booking.getStartTime())
                .endTime(booking.getEndTime())
                .totalAmount(booking.getTotalAmount())
                .timestamp(Instant.now(clock))
                .build();

        publishAfterCommit(Constants.TOPIC_BOOKING_CONFIRMED, booking.getId(), event);
    }

    public void publishBookingCancelled(Booking booking, BookingStatus previousStatus) {
        BookingCancelledEvent event = BookingCancelledEvent.builder()
                .bookingId(booking.getId())
                .providerId(booking.getProviderId())
                .customerId(booking.getCustomerId())
                .guestEmail(booking.getGuestEmail())
                .confirmationCode(booking.getConfirmationCode())
                .bookingDate(booking.getBookingDate())
                .startTime(booking.getStartTime())
                .previousStatus(previousStatus.name())
                .cancelledBy(booking.getCancelledBy())
                .reason(booking.getCancellationReason())
                .cancellationFee(booking.getCancellationFee())
                .timestamp(Instant.now(clock))
                .build();

        publishAfterCommit(Constants.TOPIC_BOOKING_CANCELLED, booking.getId(), event);
    }

    public void publishBookingCompleted(Booking booking, Provider provider) {
        BookingCompletedEvent event = BookingCompletedEvent.builder()
                .bookingId(booking.getId())
                .providerId(booking.getProviderId())
                .customerId(booking.getCustomerId())
                .guestEmail(booking.getGuestEmail())
                .payoutAccountId(provider.getPayoutAccountId())
                .totalAmount(booking.getTotalAmount())
                .platformFee(booking.getPlatformFee())
                .providerPayout(booking.getProviderPayout())
                .completedAt(booking.getCompletedAt())
                .timestamp(Instant.now(clock))
                .build();

        publishAfterCommit(Constants.TOPIC_BOOKING_COMPLETED, booking.getId(), event);
    }

    public void publishBookingRefunded(Booking booking, BookingStatus previousStatus, String reason) {
        BookingRefundedEvent event = BookingRefundedEvent.builder()
                .bookingId(booking.getId())
                .providerId(booking.getProviderId())
                .previousStatus(previousStatus.name())
                .totalAmount(booking.getTotalAmount())
                .reason(reason)
                .timestamp(Instant.now(clock))
                .build();

        publishAfterCommit(Constants.TOPIC_BOOKING_REFUNDED, booking.getId(), event);
    }

    private void publishAfterCommit(String topic, Long bookingId, Object event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publishEvent(topic, String.valueOf(bookingId), event);
                }
            });
        } else {
            publishEvent(topic, String.valueOf(bookingId), event);
        }
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                // TODO: route to an outbox table so a failed send after commit is retried
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
