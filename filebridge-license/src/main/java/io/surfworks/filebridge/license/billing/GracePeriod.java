package io.surfworks.filebridge.license.billing;

import java.time.Duration;
import java.time.Instant;

/**
 * Window after a payment failure during which the license keeps its tier.
 */
public record GracePeriod(String subscriptionId, String reason, Instant startedAt, Instant endsAt) {

    public static final Duration DEFAULT_LENGTH = Duration.ofDays(7);

    public static GracePeriod start(String subscriptionId, String reason, Instant now, Duration length) {
        return new GracePeriod(subscriptionId, reason, now, now.plus(length));
    }

    public boolean isActive(Instant now) {
        return now.isBefore(endsAt);
    }
}
