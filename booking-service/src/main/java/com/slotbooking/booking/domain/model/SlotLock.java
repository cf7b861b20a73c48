package com.slotbooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Advisory checkout claim on a slot. Expresses intent only; a booking never depends on it.
 */
@Entity
@Table(name = "slot_locks", uniqueConstraints = {
        @UniqueConstraint(name = "uk_slot_locks_slot",
                columnNames = {"provider_id", "slot_date", "start_time", "end_time"})
}, indexes = {
        @Index(name = "idx_slot_locks_expiry", columnList = "locked_until")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotLock {
    @Id
    private UUID id;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "session_id", nullable = false, length = 128)
    private String sessionId;

    @Column(name = "locked_until", nullable = false)
    private LocalDateTime lockedUntil;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public boolean isActiveAt(LocalDateTime now) {
        return lockedUntil.isAfter(now);
    }
}
