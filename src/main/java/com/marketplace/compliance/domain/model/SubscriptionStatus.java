package com.marketplace.compliance.domain.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Subscription state mirrored from the payment provider.
 */
public enum SubscriptionStatus {
    TRIALING,
    ACTIVE,
    PAST_DUE,
    CANCELED,
    INCOMPLETE,
    INCOMPLETE_EXPIRED,
    UNPAID,
    PAUSED;

    // Dunning and incomplete states keep the store subscribed until the provider cancels
    private static final Set<SubscriptionStatus> INACTIVE_STATUSES = EnumSet.of(CANCELED, PAUSED);

    /**
     * Whether a store holding a subscription in this state counts as subscribed:
     * everything except CANCELED and PAUSED.
     */
    public boolean isActive() {
        return !INACTIVE_STATUSES.contains(this);
    }

    /**
     * Maps the provider's wire value ("past_due", "canceled", ...) onto the enum.
     */
    public static Optional<SubscriptionStatus> fromProviderValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (SubscriptionStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
