package com.slotbooking.booking.domain.service;

import com.slotbooking.common.exception.ValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices a booking from its service price.
 *
 * The platform commission is a percentage of the service price and the provider receives
 * the rest. Guests pay a surcharge on top, which goes to the platform only. Amounts must
 * be whole cents within the configured transaction limits.
 *
 * Configuration:
 * booking.pricing.platform-fee-percent (default 10)
 * booking.pricing.guest-surcharge-percent (default 10)
 * booking.pricing.min-amount / max-amount (default 0.50 / 999999.99)
 */
@Component
public class PricingPolicy {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal platformFeePercent;
    private final BigDecimal guestSurchargePercent;
    private final BigDecimal minAmount;
    private final BigDecimal maxAmount;

    @Autowired
    public PricingPolicy(@Value("${booking.pricing.platform-fee-percent:10}") BigDecimal platformFeePercent,
                         @Value("${booking.pricing.guest-surcharge-percent:10}") BigDecimal guestSurchargePercent,
                         @Value("${booking.pricing.min-amount:0.50}") BigDecimal minAmount,
                         @Value("${booking.pricing.max-amount:999999.99}") BigDecimal maxAmount) {
        if (minAmount.compareTo(maxAmount) > 0) {
            throw new IllegalArgumentException("booking.pricing.min-amount must not exceed max-amount");
        }
        this.platformFeePercent = platformFeePercent;
        this.guestSurchargePercent = guestSurchargePercent;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
    }

    /**
     * Uses the caller's commission and payout when both are given (they must add up to the
     * service price), otherwise derives the commission from the platform percentage.
     *
     * @throws ValidationException on sub-cent amounts, limits, or parts that do not add up
     */
    public PriceBreakdown price(BigDecimal servicePrice, BigDecimal fee, BigDecimal payout, boolean guest) {
        if (servicePrice == null) {
            throw new ValidationException("Service price is required");
        }
        BigDecimal price = cents(servicePrice, "Service price");
        if (price.compareTo(minAmount) < 0 || price.compareTo(maxAmount) > 0) {
            throw new ValidationException(String.format("Service price %s is outside the allowed range %s-%s",
                    price, minAmount, maxAmount), "AMOUNT_OUT_OF_RANGE");
        }

        BigDecimal commission;
        BigDecimal providerPayout;
        if (fee != null && payout != null) {
            commission = cents(fee, "Platform fee");
            providerPayout = cents(payout, "Provider payout");
            if (commission.signum() < 0 || providerPayout.signum() < 0) {
                throw new ValidationException("Platform fee and provider payout must not be negative");
            }
            if (commission.add(providerPayout).compareTo(price) != 0) {
                throw new ValidationException(String.format(
                        "Platform fee %s and provider payout %s do not add up to service price %s",
                        commission, providerPayout, price));
            }
        } else if (fee != null || payout != null) {
            throw new ValidationException("Provide both platform fee and provider payout, or neither");
        } else {
            commission = percentOf(price, platformFeePercent);
            providerPayout = price.subtract(commission);
        }

        BigDecimal surcharge = guest ? percentOf(price, guestSurchargePercent) : BigDecimal.ZERO.setScale(2);
        return new PriceBreakdown(price, surcharge, price.add(surcharge), commission.add(surcharge), providerPayout);
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return amount.multiply(percent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal cents(BigDecimal amount, String field) {
        try {
            return amount.setScale(2, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new ValidationException(field + " " + amount.toPlainString() + " has more than 2 decimal places",
                    "INVALID_AMOUNT");
        }
    }
}
