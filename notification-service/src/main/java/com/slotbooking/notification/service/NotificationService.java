package com.slotbooking.notification.service;

import com.slotbooking.notification.domain.model.Notification;
import com.slotbooking.notification.domain.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Delivers stored notifications. Delivery is a log line standing in for the email/push
 * gateway; the record's status reflects the outcome either way.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    @Async("notificationExecutor")
    public void send(Notification notification) {
        log.info("Sending {} notification {} to {}", notification.getType(), notification.getId(),
                notification.getRecipient());

        try {
            if (notification.getRecipient() == null || notification.getRecipient().isBlank()) {
                throw new IllegalStateException("No recipient for " + notification.getAudience()
                        + " notification of " + notification.getEventType());
            }
            log.info("[{}] to={} subject=\"{}\" body=\"{}\"", notification.getType(), notification.getRecipient(),
                    notification.getSubject(), notification.getBody());

            notification.setStatus(Notification.NotificationStatus.SENT);
            notification.setSentAt(LocalDateTime.now(clock));
            notificationRepository.save(notification);

            log.info("Notification {} sent", notification.getId());
        } catch (Exception e) {
            log.error("Error sending notification {}", notification.getId(), e);
            notification.setStatus(Notification.NotificationStatus.FAILED);
            notification.setFailureReason(e.getMessage());
            notificationRepository.save(notification);
        }
    }
}
