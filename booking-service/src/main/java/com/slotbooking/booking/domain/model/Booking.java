package com.slotbooking.booking.domain.model;

import com.slotbooking.booking.exception.InvalidTransitionException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Appointment of a customer (or guest) with a provider for a same-day [start, end) range.
 * Never deleted: cancellation is a status. Status only changes through {@link #transitionTo}.
 * Timestamps are set by the caller from the injected UTC clock.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_provider_date", columnList = "provider_id,booking_date"),
        @Index(name = "idx_bookings_customer", columnList = "customer_id"),
        @Index(name = "idx_bookings_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "guest_email")
    private String guestEmail;

    @Column(name = "guest_name", length = 200)
    private String guestName;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Builder.Default
    @Column(name = "guest_surcharge", nullable = false, precision = 10, scale = 2)
    private BigDecimal guestSurcharge = BigDecimal.ZERO;

    /** Platform commission plus any guest surcharge; {@code platformFee + providerPayout = totalAmount}. */
    @Column(name = "platform_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal platformFee;

    @Column(name = "provider_payout", nullable = false, precision = 10, scale = 2)
    private BigDecimal providerPayout;

    @Column(name = "confirmation_code", nullable = false, unique = true, length = 12)
    private String confirmationCode;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "cancelled_by", length = 100)
    private String cancelledBy;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "cancellation_fee", precision = 10, scale = 2)
    private BigDecimal cancellationFee;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (status == null) {
            status = BookingStatus.PENDING;
        }
    }

    /**
     * Moves to {@code target} if the transition table allows it.
     *
     * @return the status before the change
     * @throws InvalidTransitionException if the move is illegal
     */
    public BookingStatus transitionTo(BookingStatus target) {
        BookingStatus current = status;
        if (current == null || !current.canTransitionTo(target)) {
            throw new InvalidTransitionException(current, target);
        }
        status = target;
        return current;
    }

    public ZonedDateTime startsAt(ZoneId zone) {
        return ZonedDateTime.of(bookingDate, startTime, zone);
    }

    public ZonedDateTime endsAt(ZoneId zone) {
        return ZonedDateTime.of(bookingDate, endTime, zone);
    }

    public String bookedBy() {
        return customerId != null ? "customer:" + customerId : "guest:" + guestEmail;
    }
}
