package com.slotbooking.booking.domain.service;

import java.math.BigDecimal;

/**
 * Money split of one booking, all amounts at scale 2.
 *
 * {@code totalAmount} is what the customer pays: the service price plus the guest surcharge.
 * {@code platformFee} is everything the platform keeps (commission plus surcharge), so
 * {@code platformFee + providerPayout == totalAmount} always holds.
 */
public record PriceBreakdown(BigDecimal servicePrice,
                             BigDecimal guestSurcharge,
                             BigDecimal totalAmount,
                             BigDecimal platformFee,
                             BigDecimal providerPayout) {

    public BigDecimal commission() {
        return platformFee.subtract(guestSurcharge);
    }
}
