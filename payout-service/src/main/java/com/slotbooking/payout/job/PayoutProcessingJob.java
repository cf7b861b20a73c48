package com.slotbooking.payout.job;

import com.slotbooking.payout.domain.service.PayoutProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic pass over due payouts. Safe to run on every instance at once; the claim
 * decides which instance transfers each payout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayoutProcessingJob {

    private final PayoutProcessor payoutProcessor;

    @Value("${payout.processing-enabled:true}")
    private boolean processingEnabled;

    @Scheduled(fixedDelayString = "${payout.processing-interval-ms:300000}")
    public void processDuePayouts() {
        if (!processingEnabled) return;
        try {
            payoutProcessor.processDuePayouts();
        } catch (Exception e) {
            log.error("Payout processing pass failed", e);
        }
    }
}
