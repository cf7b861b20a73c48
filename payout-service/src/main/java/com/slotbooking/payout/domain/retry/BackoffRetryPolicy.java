package com.slotbooking.payout.domain.retry;

import com.slotbooking.common.exception.ValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fixed list of delays, e.g. {@code 1h,6h,24h}. Attempts beyond the list reuse the last delay.
 *
 * Accepted units: {@code s}, {@code m}, {@code h}, {@code d}.
 */
@Component
public class BackoffRetryPolicy implements RetryPolicy {

    private final List<Duration> delays;
    private final int maxRetries;

    @Autowired
    public BackoffRetryPolicy(@Value("${payout.retry-delays:1h,6h,24h}") String delays,
                              @Value("${payout.max-retries:3}") int maxRetries) {
        this(parse(delays), maxRetries);
    }

    public BackoffRetryPolicy(List<Duration> delays, int maxRetries) {
        if (delays.isEmpty()) {
            throw new ValidationException("At least one retry delay is required");
        }
        if (maxRetries < 0) {
            throw new ValidationException("payout.max-retries must not be negative");
        }
        this.delays = List.copyOf(delays);
        this.maxRetries = maxRetries;
    }

    @Override
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt starts at 1, got " + attempt);
        }
        return delays.get(Math.min(attempt, delays.size()) - 1);
    }

    @Override
    public int maxRetries() {
        return maxRetries;
    }

    static List<Duration> parse(String delays) {
        List<Duration> result = new ArrayList<>();
        for (String raw : delays.split(",")) {
            String token = raw.trim().toLowerCase(Locale.ROOT);
            if (token.isEmpty()) {
                continue;
            }
            result.add(parseOne(token));
        }
        return result;
    }

    private static Duration parseOne(String token) {
        char unit = token.charAt(token.length() - 1);
        long value;
        try {
            value = Long.parseLong(token.substring(0, token.length() - 1));
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid retry delay: " + token);
        }
        if (value <= 0) {
            throw new ValidationException("Retry delay must be positive: " + token);
        }
        return switch (unit) {
            case 's' -> Duration.ofSeconds(value);
            case 'm' -> Duration.ofMinutes(value);
            case 'h' -> Duration.ofHours(value);
            case 'd' -> Duration.ofDays(value);
            default -> throw new ValidationException("Unknown retry delay unit in: " + token);
        };
    }
}
