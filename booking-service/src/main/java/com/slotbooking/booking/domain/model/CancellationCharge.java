package com.slotbooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Compensating transaction recorded when a late cancellation incurs a fee.
 */
@Entity
@Table(name = "cancellation_charges")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationCharge {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false, unique = true)
    private Long bookingId;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "platform_share", nullable = false, precision = 10, scale = 2)
    private BigDecimal platformShare;

    @Column(name = "provider_share", nullable = false, precision = 10, scale = 2)
    private BigDecimal providerShare;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
