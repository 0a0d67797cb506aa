package io.surfworks.filebridge.license.billing;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the billing side persists: licenses, subscriptions, grace periods and the webhook inbox.
 *
 * <p>Mutated only inside {@link BillingStore#transact}, which hands out a working copy.
 * Entries are immutable records, so a copy of the maps is a full snapshot.
 */
public final class BillingState {

    private LinkedHashMap<String, License> licenses = new LinkedHashMap<>();
    private LinkedHashMap<String, Subscription> subscriptions = new LinkedHashMap<>();
    private LinkedHashMap<String, GracePeriod> gracePeriods = new LinkedHashMap<>();
    private LinkedHashMap<String, SubscriptionEvent> inbox = new LinkedHashMap<>();

    public Map<String, License> licenses() {
        if (licenses == null) {
            licenses = new LinkedHashMap<>();
        }
        return licenses;
    }

    public Map<String, Subscription> subscriptions() {
        if (subscriptions == null) {
            subscriptions = new LinkedHashMap<>();
        }
        return subscriptions;
    }

    public Map<String, GracePeriod> gracePeriods() {
        if (gracePeriods == null) {
            gracePeriods = new LinkedHashMap<>();
        }
        return gracePeriods;
    }

    /**
     * Webhook events by event id, in arrival order.
     */
    public Map<String, SubscriptionEvent> inbox() {
        if (inbox == null) {
            inbox = new LinkedHashMap<>();
        }
        return inbox;
    }

    public Optional<License> license(String licenseKey) {
        return Optional.ofNullable(licenses().get(licenseKey));
    }

    public Optional<Subscription> subscription(String subscriptionId) {
        return Optional.ofNullable(subscriptions().get(subscriptionId));
    }

    public Optional<GracePeriod> gracePeriod(String subscriptionId) {
        return Optional.ofNullable(gracePeriods().get(subscriptionId));
    }

    public void putLicense(License license) {
        licenses().put(license.licenseKey(), license);
    }

    public void putSubscription(Subscription subscription) {
        subscriptions().put(subscription.subscriptionId(), subscription);
    }

    public void putEvent(SubscriptionEvent event) {
        inbox().put(event.eventId(), event);
    }

    BillingState copy() {
        BillingState copy = new BillingState();
        copy.licenses = new LinkedHashMap<>(licenses());
        copy.subscriptions = new LinkedHashMap<>(subscriptions());
        copy.gracePeriods = new LinkedHashMap<>(gracePeriods());
        copy.inbox = new LinkedHashMap<>(inbox());
        return copy;
    }
}
