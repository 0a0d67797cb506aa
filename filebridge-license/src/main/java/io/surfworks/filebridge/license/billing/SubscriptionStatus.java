package io.surfworks.filebridge.license.billing;

/**
 * Subscription states.
 *
 * <pre>
 * TRIALING -> ACTIVE -> PAST_DUE (grace) -> ACTIVE | EXPIRED
 * ACTIVE -> CANCELLED (immediate)
 * ACTIVE -> CANCEL_PENDING -> EXPIRED (at period end)
 * </pre>
 */
public enum SubscriptionStatus {
    TRIALING,
    ACTIVE,
    PAST_DUE,
    CANCEL_PENDING,
    CANCELLED,
    EXPIRED;

    /**
     * Whether the subscription's license keeps its paid tier in this state.
     */
    public boolean grantsTier() {
        return this == TRIALING || this == ACTIVE || this == PAST_DUE || this == CANCEL_PENDING;
    }

    public static SubscriptionStatus fromProviderStatus(String status) {
        return "trialing".equalsIgnoreCase(status) ? TRIALING : ACTIVE;
    }
}
