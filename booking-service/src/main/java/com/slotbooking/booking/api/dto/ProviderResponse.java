package com.slotbooking.booking.api.dto;

import com.slotbooking.booking.domain.model.Provider;

public record ProviderResponse(
        Long id,
        String displayName,
        String timezone,
        boolean active,
        String payoutAccountId
) {
    public static ProviderResponse from(Provider provider) {
        return new ProviderResponse(
                provider.getId(),
                provider.getDisplayName(),
                provider.getTimezone(),
                provider.isActive(),
                provider.getPayoutAccountId()
        );
    }
}
