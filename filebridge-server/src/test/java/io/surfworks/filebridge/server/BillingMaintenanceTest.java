package io.surfworks.filebridge.server;

import io.surfworks.filebridge.license.LicenseKeyCodec;
import io.surfworks.filebridge.license.billing.BillingState;
import io.surfworks.filebridge.license.billing.BillingStoreException;
import io.surfworks.filebridge.license.billing.InMemoryBillingStore;
import io.surfworks.filebridge.license.billing.LicenseStatus;
import io.surfworks.filebridge.license.billing.SubscriptionStatus;
import io.surfworks.filebridge.license.billing.WebhookReconciler;
import io.surfworks.filebridge.license.billing.WebhookSignatureVerifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class BillingMaintenanceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private final AtomicReference<Instant> time = new AtomicReference<>(T0);
    private final Clock clock = new Clock() {
        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return time.get();
        }
    };

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("whsec_maintenance");

    private WebhookReconciler reconciler(InMemoryBillingStore store) {
        return WebhookReconciler.builder(store, verifier, LicenseKeyCodec.withSecret("maintenance-secret"))
            .clock(clock)
            .build();
    }

    private void deliver(WebhookReconciler reconciler, String id, String type, Instant at, String data)
            throws Exception {
        String body = String.format("{\"id\": \"%s\", \"type\": \"%s\", \"timestamp\": \"%s\", \"data\": %s}",
            id, type, at, data);
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        reconciler.receive(bytes, verifier.sign(bytes));
    }

    @Test
    @DisplayName("A pass expires a subscription whose cancelled period has ended")
    void runOnce_cancelPendingPastPeriodEnd_expires() throws Exception {
        var store = new InMemoryBillingStore();
        WebhookReconciler reconciler = reconciler(store);
        Instant periodEnd = T0.plus(30, ChronoUnit.DAYS);
        deliver(reconciler, "evt_1", "subscription.created", T0, String.format(
            "{\"subscriptionId\": \"sub_1\", \"userId\": \"user_1\", \"planId\": \"filebridge_pro_monthly\", "
                + "\"expiresAt\": \"%s\"}", periodEnd));
        deliver(reconciler, "evt_2", "subscription.cancelled", T0.plusSeconds(60),
            "{\"subscriptionId\": \"sub_1\", \"immediate\": false}");

        var maintenance = new BillingMaintenance(reconciler);
        maintenance.runOnce();
        assertEquals(SubscriptionStatus.CANCEL_PENDING, subscriptionStatus(store));

        time.set(periodEnd.plusSeconds(1));
        maintenance.runOnce();

        assertEquals(SubscriptionStatus.EXPIRED, subscriptionStatus(store));
        assertEquals(LicenseStatus.EXPIRED, store.read(state -> state.licenses().values().iterator().next().status()));
        maintenance.close();
    }

    @Test
    @DisplayName("A failing store is logged and the pass returns normally")
    void runOnce_storeFailure_doesNotThrow() {
        var broken = new InMemoryBillingStore() {
            @Override
            protected void persist(BillingState state) throws BillingStoreException {
                throw new BillingStoreException("disk full");
            }
        };
        var maintenance = new BillingMaintenance(reconciler(broken));

        assertDoesNotThrow(maintenance::runOnce);
        maintenance.close();
    }

    private static SubscriptionStatus subscriptionStatus(InMemoryBillingStore store) throws BillingStoreException {
        return store.read(state -> state.subscription("sub_1").orElseThrow().status());
    }
}
