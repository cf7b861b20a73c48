package com.slotbooking.notification.domain.repository;

import com.slotbooking.notification.domain.model.Notification;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface NotificationRepository extends MongoRepository<Notification, String> {
    List<Notification> findByBookingIdOrderByCreatedAtAsc(Long bookingId);
    List<Notification> findByProviderIdOrderByCreatedAtDesc(Long providerId);
    List<Notification> findByStatus(Notification.NotificationStatus status);
}
