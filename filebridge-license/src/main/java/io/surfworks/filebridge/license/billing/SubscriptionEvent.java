package io.surfworks.filebridge.license.billing;

import java.time.Instant;
import java.util.Optional;

/**
 * One webhook delivery as recorded in the inbox.
 *
 * @param eventId provider event id, unique per event
 * @param type wire event type
 * @param subscriptionId subscription the event is about
 * @param userId subscription owner
 * @param planId provider plan id
 * @param occurredAt provider timestamp; orders events for the same subscription
 * @param periodEnd new end of the paid period, when the event carries one
 * @param immediate for cancellations, whether access ends now instead of at period end
 * @param providerStatus provider's subscription status string
 * @param status inbox processing state
 * @param attempts failed apply attempts so far
 * @param receivedAt when the event was recorded
 * @param processedAt when the event reached a final state
 * @param lastError last failure message, for manual review
 */
public record SubscriptionEvent(
    String eventId,
    String type,
    String subscriptionId,
    String userId,
    String planId,
    Instant occurredAt,
    Instant periodEnd,
    boolean immediate,
    String providerStatus,
    EventStatus status,
    int attempts,
    Instant receivedAt,
    Instant processedAt,
    String lastError
) {

    public Optional<SubscriptionEventType> eventType() {
        return SubscriptionEventType.fromWireName(type);
    }

    SubscriptionEvent withStatus(EventStatus newStatus, Instant when) {
        return new SubscriptionEvent(eventId, type, subscriptionId, userId, planId, occurredAt, periodEnd, immediate,
            providerStatus, newStatus, attempts, receivedAt, when, lastError);
    }

    SubscriptionEvent failedAttempt(String error) {
        return new SubscriptionEvent(eventId, type, subscriptionId, userId, planId, occurredAt, periodEnd, immediate,
            providerStatus, status, attempts + 1, receivedAt, processedAt, error);
    }

    SubscriptionEvent requeued() {
        return new SubscriptionEvent(eventId, type, subscriptionId, userId, planId, occurredAt, periodEnd, immediate,
            providerStatus, EventStatus.PENDING, 0, receivedAt, null, lastError);
    }
}
