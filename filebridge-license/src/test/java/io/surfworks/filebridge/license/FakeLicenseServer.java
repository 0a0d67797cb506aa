package io.surfworks.filebridge.license;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link LicenseServer} for tests.
 */
public class FakeLicenseServer implements LicenseServer {

    private final AtomicInteger validations = new AtomicInteger();
    private volatile ValidationResponse response = ValidationResponse.invalid(
        ValidationResponse.LICENSE_NOT_FOUND, "License key not found");
    private volatile boolean available = true;
    private volatile Duration delay = Duration.ZERO;
    private volatile CountDownLatch gate;

    public static FakeLicenseServer validFor(Tier tier, Instant expiresAt) {
        FakeLicenseServer server = new FakeLicenseServer();
        server.respondWith(ValidationResponse.valid(tier, List.copyOf(FeatureGate.STANDARD.features(tier)), expiresAt));
        return server;
    }

    public void respondWith(ValidationResponse response) {
        this.response = response;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setDelay(Duration delay) {
        this.delay = delay;
    }

    /**
     * Hold every validation until the returned latch is released.
     */
    public CountDownLatch holdValidations() {
        CountDownLatch latch = new CountDownLatch(1);
        this.gate = latch;
        return latch;
    }

    public int validationCount() {
        return validations.get();
    }

    @Override
    public ValidationResponse validate(ValidationRequest request) throws RemoteUnavailableException {
        validations.incrementAndGet();
        try {
            CountDownLatch latch = gate;
            if (latch != null && !latch.await(10, TimeUnit.SECONDS)) {
                throw new RemoteUnavailableException("test gate never opened");
            }
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteUnavailableException("interrupted", e);
        }
        if (!available) {
            throw new RemoteUnavailableException("connection refused");
        }
        return response;
    }

    @Override
    public String generate(String userId, Tier tier, String subscriptionId, Instant expiresAt)
            throws RemoteUnavailableException {
        throw new RemoteUnavailableException("not supported by the fake");
    }

    @Override
    public boolean revoke(String licenseKey) {
        return false;
    }

    @Override
    public String getServerName() {
        return "fake";
    }
}
