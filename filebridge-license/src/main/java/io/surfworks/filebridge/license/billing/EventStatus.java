package io.surfworks.filebridge.license.billing;

/**
 * Processing state of a webhook event in the inbox.
 */
public enum EventStatus {
    /** Recorded, not yet applied. */
    PENDING,
    /** Applied. */
    PROCESSED,
    /** Older than the last event applied to its subscription; recorded without effect. */
    SUPERSEDED,
    /** Event type this system does not act on. */
    IGNORED,
    /** Retries exhausted; waiting for manual review. */
    PARKED;

    public boolean isFinal() {
        return this == PROCESSED || this == SUPERSEDED || this == IGNORED;
    }
}
