package io.surfworks.filebridge.server;

import io.surfworks.filebridge.license.billing.BillingStoreException;
import io.surfworks.filebridge.license.billing.WebhookReconciler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically finishes pending webhook events and expires lapsed subscriptions.
 */
public class BillingMaintenance implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(BillingMaintenance.class.getName());

    private final WebhookReconciler reconciler;
    private final ScheduledExecutorService executor;

    public BillingMaintenance(WebhookReconciler reconciler) {
        this.reconciler = reconciler;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "filebridge-billing-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start(Duration period) {
        executor.scheduleAtFixedRate(this::runOnce, 0, period.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Billing maintenance every " + period);
    }

    /**
     * One maintenance pass. Failures are logged and retried on the next pass.
     */
    void runOnce() {
        try {
            reconciler.reprocessPending();
            List<String> expired = reconciler.sweepExpired();
            if (!expired.isEmpty()) {
                LOG.info("Expired subscriptions: " + expired);
            }
            int parked = reconciler.parkedEvents().size();
            if (parked > 0) {
                LOG.warning(parked + " webhook event(s) parked for manual review");
            }
        } catch (BillingStoreException | RuntimeException e) {
            LOG.log(Level.WARNING, "Billing maintenance pass failed", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
