package io.surfworks.filebridge.license.billing;

/**
 * What happened to one webhook delivery.
 *
 * @param eventId provider event id
 * @param outcome result
 * @param message detail for logs and the HTTP response
 */
public record WebhookReceipt(String eventId, Outcome outcome, String message) {

    public enum Outcome {
        /** State transition committed. */
        APPLIED,
        /** Event id seen before; nothing changed. */
        DUPLICATE,
        /** Ordered before the last applied event for the subscription; recorded without effect. */
        SUPERSEDED,
        /** Event type not acted on; recorded without effect. */
        IGNORED,
        /** Retries exhausted; recorded for manual review. */
        PARKED,
        /** Recorded but not applied yet; redelivery or reprocessing will finish it. */
        QUEUED
    }

    /**
     * Whether the provider may stop redelivering. Only events that reached a durable
     * resolution are acknowledged.
     */
    public boolean acknowledged() {
        return outcome != Outcome.QUEUED;
    }
}
