package io.surfworks.filebridge.license.billing;

import io.surfworks.filebridge.license.Tier;

import java.time.Instant;

/**
 * A billing-provider subscription and the license it pays for.
 *
 * @param subscriptionId provider subscription id
 * @param userId owner
 * @param planId provider plan id
 * @param tier tier the plan maps to
 * @param status current state
 * @param currentPeriodEnd end of the paid period
 * @param licenseKey license issued for this subscription
 * @param lastEventAt provider timestamp of the last applied event
 */
public record Subscription(
    String subscriptionId,
    String userId,
    String planId,
    Tier tier,
    SubscriptionStatus status,
    Instant currentPeriodEnd,
    String licenseKey,
    Instant lastEventAt
) {

    Subscription withStatus(SubscriptionStatus newStatus, Instant eventAt) {
        return new Subscription(subscriptionId, userId, planId, tier, newStatus, currentPeriodEnd, licenseKey, eventAt);
    }

    Subscription renewed(Instant periodEnd, Instant eventAt) {
        return new Subscription(subscriptionId, userId, planId, tier, SubscriptionStatus.ACTIVE,
            periodEnd != null ? periodEnd : currentPeriodEnd, licenseKey, eventAt);
    }

    Subscription withPeriodEnd(Instant periodEnd) {
        return new Subscription(subscriptionId, userId, planId, tier, status, periodEnd, licenseKey, lastEventAt);
    }

    Subscription withPlan(String newPlanId, Tier newTier, Instant eventAt) {
        return new Subscription(subscriptionId, userId, newPlanId, newTier, status, currentPeriodEnd, licenseKey, eventAt);
    }
}
