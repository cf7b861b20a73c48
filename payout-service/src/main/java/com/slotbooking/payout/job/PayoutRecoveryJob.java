package com.slotbooking.payout.job;

import com.slotbooking.payout.domain.repository.PayoutScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Returns payouts stuck in PROCESSING (worker crashed between claim and outcome) to
 * SCHEDULED. The retry reuses the payout's idempotency key, so the provider does not
 * execute the transfer twice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayoutRecoveryJob {

    private final PayoutScheduleRepository payoutRepository;
    private final Clock clock;

    @Value("${payout.recovery-enabled:true}")
    private boolean recoveryEnabled;

    /** Must exceed the Feign read timeout by a wide margin. */
    @Value("${payout.stuck-threshold-minutes:30}")
    private int stuckThresholdMinutes;

    @Scheduled(fixedDelayString = "${payout.recovery-interval-ms:600000}")
    public void recoverStuckPayouts() {
        if (!recoveryEnabled) return;
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            int reset = payoutRepository.resetStuck(now.minusMinutes(stuckThresholdMinutes), now);
            if (reset > 0) {
                log.warn("Payout recovery: returned {} stuck payout(s) to SCHEDULED", reset);
            }
        } catch (Exception e) {
            log.error("Payout recovery failed", e);
        }
    }
}
