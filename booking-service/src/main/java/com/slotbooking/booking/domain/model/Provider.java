package com.slotbooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Service provider whose weekly windows and blocked dates drive slot availability.
 * The row doubles as the serialization point for concurrent booking attempts
 * (see {@code PessimisticBookingGuard}).
 */
@Entity
@Table(name = "providers")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Provider {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "display_name", nullable = false, length = 200)
    private String displayName;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Column(name = "active", nullable = false)
    private boolean active;

    /** External payment-provider account receiving payouts. */
    @Column(name = "payout_account_id", length = 100)
    private String payoutAccountId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (timezone == null) {
            timezone = "UTC";
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }
}
