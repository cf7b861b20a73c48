package com.slotbooking.payout.api.dto;

import com.slotbooking.payout.domain.model.PayoutSchedule;
import org.springframework.data.domain.Page;

import java.util.List;

public record PayoutPageResponse(
        List<PayoutResponse> items,
        int page,
        int size,
        long totalItems,
        int totalPages
) {
    public static PayoutPageResponse from(Page<PayoutSchedule> page) {
        return new PayoutPageResponse(
                page.getContent().stream().map(PayoutResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages());
    }
}
