package com.slotbooking.notification.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * One message produced from a booking or payout event. Kept as delivery history.
 */
@Document(collection = "notifications")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    @Id
    private String id;

    /** Kafka topic the notification was produced from. */
    private String eventType;
    private Audience audience;
    @Indexed
    private Long bookingId;
    private Long customerId;
    private Long providerId;
    private Long payoutId;
    private NotificationType type;
    private NotificationStatus status;
    private String recipient;
    private String subject;
    private String body;
    private String failureReason;
    private LocalDateTime sentAt;
    private LocalDateTime createdAt;

    public enum Audience {
        CUSTOMER,
        PROVIDER,
        OPERATOR
    }

    public enum NotificationType {
        EMAIL,
        SMS,
        PUSH
    }

    public enum NotificationStatus {
        PENDING,
        SENT,
        FAILED
    }
}
