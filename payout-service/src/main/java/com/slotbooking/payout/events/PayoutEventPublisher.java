package com.slotbooking.payout.events;

import com.slotbooking.common.util.Constants;
import com.slotbooking.payout.domain.model.PayoutSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for payout outcomes, keyed by booking id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayoutEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publishPayoutCompleted(PayoutSchedule payout, String transferId, boolean manual) {
        PayoutCompletedEvent event = PayoutCompletedEvent.builder()
                .payoutId(payout.getId())
                .bookingId(payout.getBookingId())
                .providerId(payout.getProviderId())
                .netPayout(payout.getNetPayout())
                .currency(payout.getCurrency())
                .transferId(transferId)
                .manual(manual)
                .timestamp(Instant.now(clock))
                .build();

        publishEvent(Constants.TOPIC_PAYOUT_COMPLETED, String.valueOf(payout.getBookingId()), event);
    }

    public void publishPayoutFailed(PayoutSchedule payout, int retryCount, boolean permanent, String reason) {
        PayoutFailedEvent event = PayoutFailedEvent.builder()
                .payoutId(payout.getId())
                .bookingId(payout.getBookingId())
                .providerId(payout.getProviderId())
                .netPayout(payout.getNetPayout())
                .currency(payout.getCurrency())
                .retryCount(retryCount)
                .permanent(permanent)
                .failureReason(reason)
                .timestamp(Instant.now(clock))
                .build();

        publishEvent(Constants.TOPIC_PAYOUT_FAILED, String.valueOf(payout.getBookingId()), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
