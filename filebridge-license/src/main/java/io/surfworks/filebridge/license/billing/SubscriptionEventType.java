package io.surfworks.filebridge.license.billing;

import java.util.Optional;

/**
 * Billing lifecycle events, with the provider's wire names.
 *
 * <p>When two events for one subscription carry the same provider timestamp, the one with the
 * higher {@link #precedence()} is treated as the later one. A cancellation outranks a renewal.
 */
public enum SubscriptionEventType {
    SUBSCRIPTION_CREATED("subscription.created", 0),
    SUBSCRIPTION_UPDATED("subscription.updated", 1),
    SUBSCRIPTION_RENEWED("subscription.renewed", 3),
    SUBSCRIPTION_CANCELLED("subscription.cancelled", 4),
    PAYMENT_FAILED("payment.failed", 2);

    private final String wireName;
    private final int precedence;

    SubscriptionEventType(String wireName, int precedence) {
        this.wireName = wireName;
        this.precedence = precedence;
    }

    public String getWireName() {
        return wireName;
    }

    public int precedence() {
        return precedence;
    }

    public static Optional<SubscriptionEventType> fromWireName(String name) {
        for (SubscriptionEventType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
