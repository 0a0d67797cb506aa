package io.surfworks.filebridge.license.billing;

import io.surfworks.filebridge.license.EntitlementStore;
import io.surfworks.filebridge.license.InMemoryEntitlementStore;
import io.surfworks.filebridge.license.LicenseKeyCodec;
import io.surfworks.filebridge.license.Tier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Applies billing-provider lifecycle events to subscriptions and licenses.
 *
 * <p>Events go through an inbox. A verified event is first recorded as {@link EventStatus#PENDING};
 * its state transition is then applied in a single transaction that also marks it processed.
 * Only then is the delivery acknowledged, and only then are cached entitlements for the
 * affected license dropped. An event id already in the inbox is never applied again.
 *
 * <p>Failed applications are retried with backoff. After {@link RetryPolicy#maxAttempts()} the
 * event is parked for manual review; {@link #requeue(String)} puts it back. Parked events for a
 * subscription that did not exist yet are requeued when its {@code subscription.created} lands.
 * Each attempt holds the reconciler lock; the backoff between attempts does not.
 *
 * <p>Events for one subscription are ordered by provider timestamp, then by
 * {@link SubscriptionEventType#precedence()}, then by event id. An event that orders before the
 * last one applied to its subscription is recorded as superseded and logged, so a cancellation
 * and a renewal resolve the same way regardless of delivery order.
 */
public class WebhookReconciler {

    private static final Logger LOG = Logger.getLogger(WebhookReconciler.class.getName());

    private static final Comparator<SubscriptionEvent> SAME_TIMESTAMP_ORDER = Comparator
        .comparingInt((SubscriptionEvent e) -> e.eventType().map(SubscriptionEventType::precedence).orElse(-1))
        .thenComparing(SubscriptionEvent::eventId);

    /**
     * Waits between retries.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final BillingStore store;
    private final WebhookSignatureVerifier verifier;
    private final WebhookEventParser parser = new WebhookEventParser();
    private final LicenseKeyCodec codec;
    private final EntitlementStore entitlementCache;
    private final LicenseDelivery delivery;
    private final PlanMapper plans;
    private final RetryPolicy retryPolicy;
    private final Duration gracePeriod;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Object lock = new Object();

    private WebhookReconciler(Builder builder) {
        this.store = builder.store;
        this.verifier = builder.verifier;
        this.codec = builder.codec;
        this.entitlementCache = builder.entitlementCache;
        this.delivery = builder.delivery;
        this.plans = builder.plans;
        this.retryPolicy = builder.retryPolicy;
        this.gracePeriod = builder.gracePeriod;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
    }

    public static Builder builder(BillingStore store, WebhookSignatureVerifier verifier, LicenseKeyCodec codec) {
        return new Builder(store, verifier, codec);
    }

    /**
     * Verify, record and apply one webhook delivery.
     *
     * @param rawBody the request body exactly as received
     * @param signature the provider's signature header
     * @throws WebhookSignatureException if the signature is wrong; nothing is recorded
     * @throws InvalidWebhookPayloadException if the body cannot be parsed; nothing is recorded
     * @throws BillingStoreException if the event could not be recorded; the provider should redeliver
     */
    public WebhookReceipt receive(byte[] rawBody, String signature)
            throws WebhookSignatureException, InvalidWebhookPayloadException, BillingStoreException {
        verifier.verify(rawBody, signature);
        SubscriptionEvent event = parser.parse(rawBody, clock.instant());
        return process(event);
    }

    /**
     * Record and apply an already verified event.
     */
    public WebhookReceipt process(SubscriptionEvent event) throws BillingStoreException {
        SubscriptionEvent existing;
        synchronized (lock) {
            existing = store.transact(state -> {
                SubscriptionEvent seen = state.inbox().get(event.eventId());
                if (seen == null) {
                    state.putEvent(event);
                }
                return seen;
            });
        }

        if (existing != null && existing.status() != EventStatus.PENDING) {
            LOG.info("Duplicate webhook event " + event.eventId() + " ignored (" + existing.status() + ")");
            return new WebhookReceipt(event.eventId(), WebhookReceipt.Outcome.DUPLICATE,
                "Event already " + existing.status().name().toLowerCase());
        }
        if (existing == null) {
            LOG.fine("Recorded webhook event " + event.eventId() + " (" + event.type() + ")");
        }
        return applyWithRetry(event.eventId());
    }

    /**
     * Apply every event still pending, for example after a crash between recording and applying.
     */
    public List<WebhookReceipt> reprocessPending() throws BillingStoreException {
        List<String> pending = store.read(state -> state.inbox().values().stream()
            .filter(e -> e.status() == EventStatus.PENDING)
            .map(SubscriptionEvent::eventId)
            .collect(Collectors.toList()));

        List<WebhookReceipt> receipts = new ArrayList<>();
        for (String eventId : pending) {
            receipts.add(applyWithRetry(eventId));
        }
        if (!receipts.isEmpty()) {
            LOG.info("Reprocessed " + receipts.size() + " pending webhook event(s)");
        }
        return receipts;
    }

    /**
     * Expire subscriptions whose grace period or cancellation date has passed.
     *
     * @return ids of the subscriptions that expired
     */
    public List<String> sweepExpired() throws BillingStoreException {
        Instant now = clock.instant();
        List<Subscription> expired;
        synchronized (lock) {
            expired = store.transact(state -> {
                List<Subscription> changed = new ArrayList<>();
                for (Subscription subscription : new ArrayList<>(state.subscriptions().values())) {
                    if (isDue(state, subscription, now)) {
                        changed.add(expireNow(state, subscription, subscription.lastEventAt()));
                    }
                }
                return changed;
            });
        }

        for (Subscription subscription : expired) {
            LOG.info("Subscription " + subscription.subscriptionId() + " expired; license "
                + LicenseKeyCodec.mask(subscription.licenseKey()) + " reverts to FREE");
            invalidate(List.of(subscription.licenseKey()));
        }
        return expired.stream().map(Subscription::subscriptionId).collect(Collectors.toList());
    }

    /**
     * Events waiting for manual review.
     */
    public List<SubscriptionEvent> parkedEvents() throws BillingStoreException {
        return store.read(state -> state.inbox().values().stream()
            .filter(e -> e.status() == EventStatus.PARKED)
            .collect(Collectors.toList()));
    }

    /**
     * Put a parked event back in the queue and try it again.
     *
     * @return the new receipt, or empty if no parked event has that id
     */
    public Optional<WebhookReceipt> requeue(String eventId) throws BillingStoreException {
        boolean requeued;
        synchronized (lock) {
            requeued = store.transact(state -> {
                SubscriptionEvent event = state.inbox().get(eventId);
                if (event == null || event.status() != EventStatus.PARKED) {
                    return false;
                }
                state.putEvent(event.requeued());
                return true;
            });
        }
        if (!requeued) {
            return Optional.empty();
        }
        LOG.info("Requeued parked webhook event " + eventId);
        return Optional.of(applyWithRetry(eventId));
    }

    // ========== Applying events ==========

    private WebhookReceipt applyWithRetry(String eventId) {
        for (int attempt = 1; ; attempt++) {
            Applied applied;
            try {
                synchronized (lock) {
                    applied = store.transact(state -> apply(state, eventId, clock.instant()));
                    invalidate(applied.invalidate());
                }
            } catch (BillingStoreException | RuntimeException e) {
                LOG.log(Level.WARNING, String.format("Applying webhook event %s failed (attempt %d/%d)",
                    eventId, attempt, retryPolicy.maxAttempts()), e);
                WebhookReceipt parked;
                synchronized (lock) {
                    recordFailure(eventId, e);
                    parked = attempt >= retryPolicy.maxAttempts() ? park(eventId, e) : null;
                }
                if (parked != null) {
                    return parked;
                }
                try {
                    sleeper.sleep(retryPolicy.backoff(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return new WebhookReceipt(eventId, WebhookReceipt.Outcome.QUEUED,
                        "Interrupted; event left pending");
                }
                continue;
            }

            if (applied.issued() != null) {
                deliver(applied.issued(), applied.subscription());
            }
            for (String requeued : applied.requeued()) {
                WebhookReceipt followUp = applyWithRetry(requeued);
                LOG.info("Requeued webhook event " + requeued + " for " + applied.subscription().subscriptionId()
                    + ": " + followUp.outcome());
            }
            return applied.receipt();
        }
    }

    private Applied apply(BillingState state, String eventId, Instant now) {
        SubscriptionEvent event = state.inbox().get(eventId);
        if (event == null) {
            throw new IllegalStateException("Event " + eventId + " is not in the inbox");
        }
        if (event.status().isFinal()) {
            return Applied.only(new WebhookReceipt(eventId, WebhookReceipt.Outcome.DUPLICATE,
                "Event already " + event.status().name().toLowerCase()));
        }

        Optional<SubscriptionEventType> type = event.eventType();
        if (type.isEmpty()) {
            LOG.warning("Unhandled webhook type '" + event.type() + "' for event " + eventId);
            state.putEvent(event.withStatus(EventStatus.IGNORED, now));
            return Applied.only(new WebhookReceipt(eventId, WebhookReceipt.Outcome.IGNORED,
                "Unhandled event type " + event.type()));
        }

        Optional<Subscription> current = state.subscription(event.subscriptionId());
        if (type.get() == SubscriptionEventType.SUBSCRIPTION_CREATED) {
            if (current.isPresent()) {
                return supersede(state, event, now, "subscription " + event.subscriptionId() + " already exists");
            }
            return created(state, event, now);
        }

        Subscription subscription = current.orElseThrow(() ->
            new IllegalStateException("Unknown subscription " + event.subscriptionId()));
        Optional<String> outranked = outrankedBy(state, event, subscription);
        if (outranked.isPresent()) {
            if (type.get() == SubscriptionEventType.SUBSCRIPTION_RENEWED) {
                keepPaidPeriod(state, event, subscription);
            }
            return supersede(state, event, now, outranked.get() + "; keeping " + subscription.status());
        }

        switch (type.get()) {
            case SUBSCRIPTION_UPDATED -> updated(state, event, subscription);
            case SUBSCRIPTION_RENEWED -> renewed(state, event, subscription);
            case PAYMENT_FAILED -> paymentFailed(state, event, subscription, now);
            case SUBSCRIPTION_CANCELLED -> cancelled(state, event, subscription, now);
            default -> throw new IllegalStateException("Unexpected event type " + type.get());
        }
        state.putEvent(event.withStatus(EventStatus.PROCESSED, now));
        return new Applied(
            new WebhookReceipt(event.eventId(), WebhookReceipt.Outcome.APPLIED, event.type() + " applied"),
            List.of(subscription.licenseKey()), null, subscription, List.of());
    }

    /**
     * Why {@code event} orders before the last event applied to its subscription, or empty if it
     * orders after it.
     */
    private static Optional<String> outrankedBy(BillingState state, SubscriptionEvent event, Subscription subscription) {
        Instant last = subscription.lastEventAt();
        if (last == null || event.occurredAt().isAfter(last)) {
            return Optional.empty();
        }
        if (event.occurredAt().isBefore(last)) {
            return Optional.of(String.format("it happened at %s, before the last applied event at %s",
                event.occurredAt(), last));
        }

        Optional<SubscriptionEvent> tied = state.inbox().values().stream()
            .filter(e -> e.status() == EventStatus.PROCESSED)
            .filter(e -> subscription.subscriptionId().equals(e.subscriptionId()))
            .filter(e -> last.equals(e.occurredAt()))
            .max(SAME_TIMESTAMP_ORDER);
        if (tied.isEmpty()) {
            return Optional.empty();
        }
        SubscriptionEvent winner = tied.get();
        if (SAME_TIMESTAMP_ORDER.compare(event, winner) < 0) {
            return Optional.of(String.format("it shares timestamp %s with applied event %s (%s), which takes precedence",
                last, winner.eventId(), winner.type()));
        }
        LOG.info(String.format("Webhook event %s (%s) shares timestamp %s with %s (%s) and takes precedence over it",
            event.eventId(), event.type(), last, winner.eventId(), winner.type()));
        return Optional.empty();
    }

    private Applied created(BillingState state, SubscriptionEvent event, Instant now) {
        Tier tier = plans.tierFor(event.planId());
        String licenseKey = codec.generate(tier, event.userId() != null ? event.userId() : event.subscriptionId());
        License license = License.issue(licenseKey, event.userId(), tier, event.subscriptionId(), now, event.periodEnd());
        Subscription subscription = new Subscription(event.subscriptionId(), event.userId(), event.planId(), tier,
            SubscriptionStatus.fromProviderStatus(event.providerStatus()), event.periodEnd(), licenseKey,
            event.occurredAt());

        state.putLicense(license);
        state.putSubscription(subscription);
        state.putEvent(event.withStatus(EventStatus.PROCESSED, now));

        List<String> requeued = new ArrayList<>();
        for (SubscriptionEvent parked : new ArrayList<>(state.inbox().values())) {
            if (parked.status() == EventStatus.PARKED && event.subscriptionId().equals(parked.subscriptionId())) {
                state.putEvent(parked.requeued());
                requeued.add(parked.eventId());
            }
        }
        return new Applied(
            new WebhookReceipt(event.eventId(), WebhookReceipt.Outcome.APPLIED, "Issued " + tier + " license"),
            List.of(), license, subscription, requeued);
    }

    private void updated(BillingState state, SubscriptionEvent event, Subscription subscription) {
        String planId = event.planId() != null ? event.planId() : subscription.planId();
        Tier tier = plans.tierFor(planId);
        if (tier != subscription.tier()) {
            LOG.info(String.format("Subscription %s changed plan: %s -> %s",
                subscription.subscriptionId(), subscription.tier(), tier));
        }
        state.putSubscription(subscription.withPlan(planId, tier, event.occurredAt()));
        state.license(subscription.licenseKey()).ifPresent(license -> state.putLicense(license.withTier(tier)));
    }

    private void renewed(BillingState state, SubscriptionEvent event, Subscription subscription) {
        if (subscription.status() != SubscriptionStatus.ACTIVE) {
            LOG.info(String.format("Renewal of subscription %s overrides status %s",
                subscription.subscriptionId(), subscription.status()));
        }
        Subscription renewed = subscription.renewed(event.periodEnd(), event.occurredAt());
        state.putSubscription(renewed);
        state.gracePeriods().remove(subscription.subscriptionId());

        state.license(subscription.licenseKey()).ifPresent(license -> {
            if (license.status() == LicenseStatus.REVOKED) {
                LOG.warning("Subscription " + subscription.subscriptionId() + " renewed but its license "
                    + LicenseKeyCodec.mask(license.licenseKey()) + " is revoked; leaving it revoked");
                return;
            }
            state.putLicense(license.withStatus(LicenseStatus.ACTIVE).withExpiresAt(renewed.currentPeriodEnd()));
        });
    }

    private void paymentFailed(BillingState state, SubscriptionEvent event, Subscription subscription, Instant now) {
        if (!subscription.status().grantsTier()) {
            LOG.info("Payment failure for " + subscription.subscriptionId() + " ignored; subscription is "
                + subscription.status());
            state.putSubscription(subscription.withStatus(subscription.status(), event.occurredAt()));
            return;
        }
        Optional<GracePeriod> existing = state.gracePeriod(subscription.subscriptionId());
        if (subscription.status() == SubscriptionStatus.PAST_DUE && existing.isPresent()
                && !existing.get().isActive(now)) {
            LOG.info("Payment failed again for subscription " + subscription.subscriptionId()
                + " after its grace period ended on " + existing.get().endsAt() + "; expiring it");
            expireNow(state, subscription, event.occurredAt());
            return;
        }
        GracePeriod grace = existing
            .filter(g -> g.isActive(now))
            .orElseGet(() -> GracePeriod.start(subscription.subscriptionId(), "payment_failed", now, gracePeriod));
        state.gracePeriods().put(subscription.subscriptionId(), grace);
        state.putSubscription(subscription.withStatus(SubscriptionStatus.PAST_DUE, event.occurredAt()));
        LOG.info("Payment failed for subscription " + subscription.subscriptionId() + "; grace period ends "
            + grace.endsAt());
    }

    private void cancelled(BillingState state, SubscriptionEvent event, Subscription subscription, Instant now) {
        state.gracePeriods().remove(subscription.subscriptionId());
        Instant periodEnd = subscription.currentPeriodEnd();
        boolean endsNow = event.immediate() || periodEnd == null || !now.isBefore(periodEnd);

        if (endsNow) {
            SubscriptionStatus status = event.immediate() ? SubscriptionStatus.CANCELLED : SubscriptionStatus.EXPIRED;
            state.putSubscription(subscription.withStatus(status, event.occurredAt()));
            expireLicense(state, subscription.licenseKey());
            LOG.info("Subscription " + subscription.subscriptionId() + " cancelled; access ends now");
        } else {
            state.putSubscription(subscription.withStatus(SubscriptionStatus.CANCEL_PENDING, event.occurredAt()));
            LOG.info("Subscription " + subscription.subscriptionId() + " cancelled; access continues until " + periodEnd);
        }
    }

    /**
     * A late renewal loses its status change but the period it paid for still counts.
     */
    private static void keepPaidPeriod(BillingState state, SubscriptionEvent event, Subscription subscription) {
        Instant paidUntil = event.periodEnd();
        if (paidUntil == null
                || (subscription.currentPeriodEnd() != null && !paidUntil.isAfter(subscription.currentPeriodEnd()))) {
            return;
        }
        state.putSubscription(subscription.withPeriodEnd(paidUntil));
        state.license(subscription.licenseKey())
            .filter(license -> license.status() != LicenseStatus.REVOKED)
            .ifPresent(license -> state.putLicense(license.withExpiresAt(paidUntil)));
    }

    private static Applied supersede(BillingState state, SubscriptionEvent event, Instant now, String why) {
        LOG.warning("Webhook event " + event.eventId() + " (" + event.type() + ") superseded: " + why);
        state.putEvent(event.withStatus(EventStatus.SUPERSEDED, now));
        return Applied.only(new WebhookReceipt(event.eventId(), WebhookReceipt.Outcome.SUPERSEDED, why));
    }

    private static boolean isDue(BillingState state, Subscription subscription, Instant now) {
        return switch (subscription.status()) {
            case PAST_DUE -> state.gracePeriod(subscription.subscriptionId())
                .map(grace -> !grace.isActive(now))
                .orElse(true);
            case CANCEL_PENDING -> subscription.currentPeriodEnd() == null
                || !now.isBefore(subscription.currentPeriodEnd());
            default -> false;
        };
    }

    private static Subscription expireNow(BillingState state, Subscription subscription, Instant eventAt) {
        Subscription expired = subscription.withStatus(SubscriptionStatus.EXPIRED, eventAt);
        state.putSubscription(expired);
        state.gracePeriods().remove(subscription.subscriptionId());
        expireLicense(state, subscription.licenseKey());
        return expired;
    }

    private static void expireLicense(BillingState state, String licenseKey) {
        state.license(licenseKey)
            .filter(license -> license.status() == LicenseStatus.ACTIVE)
            .ifPresent(license -> state.putLicense(license.withStatus(LicenseStatus.EXPIRED)));
    }

    private void recordFailure(String eventId, Exception cause) {
        try {
            store.transact(state -> {
                SubscriptionEvent event = state.inbox().get(eventId);
                if (event != null && event.status() == EventStatus.PENDING) {
                    state.putEvent(event.failedAttempt(String.valueOf(cause.getMessage())));
                }
                return null;
            });
        } catch (BillingStoreException | RuntimeException e) {
            LOG.log(Level.FINE, "Could not record failed attempt for " + eventId, e);
        }
    }

    private WebhookReceipt park(String eventId, Exception cause) {
        try {
            store.transact(state -> {
                SubscriptionEvent event = state.inbox().get(eventId);
                if (event != null && event.status() == EventStatus.PENDING) {
                    state.putEvent(event.withStatus(EventStatus.PARKED, clock.instant()));
                }
                return null;
            });
        } catch (BillingStoreException | RuntimeException e) {
            LOG.log(Level.SEVERE, "Could not park webhook event " + eventId + "; it stays pending", e);
            return new WebhookReceipt(eventId, WebhookReceipt.Outcome.QUEUED,
                "Processing failed and the event could not be parked: " + cause.getMessage());
        }
        LOG.severe("Webhook event " + eventId + " parked for manual review after "
            + retryPolicy.maxAttempts() + " attempts: " + cause.getMessage());
        return new WebhookReceipt(eventId, WebhookReceipt.Outcome.PARKED, String.valueOf(cause.getMessage()));
    }

    private void invalidate(List<String> licenseKeys) {
        for (String key : licenseKeys) {
            if (key != null) {
                entitlementCache.invalidate(key);
            }
        }
    }

    private void deliver(License license, Subscription subscription) {
        try {
            delivery.deliver(license, subscription);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "License " + LicenseKeyCodec.mask(license.licenseKey())
                + " was issued but delivery failed", e);
        }
    }

    /**
     * Result of one committed transaction.
     */
    private record Applied(WebhookReceipt receipt, List<String> invalidate, License issued,
                           Subscription subscription, List<String> requeued) {
        static Applied only(WebhookReceipt receipt) {
            return new Applied(receipt, List.of(), null, null, List.of());
        }
    }

    public static final class Builder {
        private final BillingStore store;
        private final WebhookSignatureVerifier verifier;
        private final LicenseKeyCodec codec;
        private EntitlementStore entitlementCache = new InMemoryEntitlementStore();
        private LicenseDelivery delivery = LicenseDelivery.LOGGING;
        private PlanMapper plans = PlanMapper.DEFAULT;
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
        private Duration gracePeriod = GracePeriod.DEFAULT_LENGTH;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

        private Builder(BillingStore store, WebhookSignatureVerifier verifier, LicenseKeyCodec codec) {
            if (!codec.canVerifyChecksum()) {
                throw new IllegalArgumentException("Issuing licenses needs a codec holding the signing secret");
            }
            this.store = store;
            this.verifier = verifier;
            this.codec = codec;
        }

        /**
         * Cache whose entries are dropped when a license changes.
         */
        public Builder entitlementCache(EntitlementStore entitlementCache) {
            this.entitlementCache = entitlementCache;
            return this;
        }

        public Builder delivery(LicenseDelivery delivery) {
            this.delivery = delivery;
            return this;
        }

        public Builder plans(PlanMapper plans) {
            this.plans = plans;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder gracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public WebhookReconciler build() {
            return new WebhookReconciler(this);
        }
    }
}
