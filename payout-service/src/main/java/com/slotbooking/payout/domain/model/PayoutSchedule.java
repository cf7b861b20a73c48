package com.slotbooking.payout.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Escrowed transfer of a provider's share for one completed booking.
 * All timestamps are UTC.
 */
@Entity
@Table(name = "payout_schedules", uniqueConstraints = {
        @UniqueConstraint(name = "uk_payout_schedules_booking", columnNames = "booking_id")
}, indexes = {
        @Index(name = "idx_payout_provider", columnList = "provider_id, created_at"),
        @Index(name = "idx_payout_status_scheduled", columnList = "status, scheduled_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutSchedule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "payout_account_id", nullable = false, length = 100)
    private String payoutAccountId;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "platform_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal platformFee;

    @Column(name = "net_payout", nullable = false, precision = 10, scale = 2)
    private BigDecimal netPayout;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "scheduled_at", nullable = false)
    private LocalDateTime scheduledAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "transfer_id", length = 100)
    private String transferId;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "resolution_note", length = 500)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
        if (status == null) {
            status = PayoutStatus.SCHEDULED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /** Key sent to the payment provider; stable across retries of the same payout. */
    public String idempotencyKey() {
        return "payout-" + id;
    }

    public enum PayoutStatus {
        SCHEDULED,
        PROCESSING,
        COMPLETED,
        FAILED,
        CANCELLED
    }
}
