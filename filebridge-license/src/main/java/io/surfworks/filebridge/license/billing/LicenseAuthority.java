package io.surfworks.filebridge.license.billing;

import io.surfworks.filebridge.license.EntitlementStore;
import io.surfworks.filebridge.license.FeatureGate;
import io.surfworks.filebridge.license.InvalidLicenseKeyException;
import io.surfworks.filebridge.license.LicenseKeyCodec;
import io.surfworks.filebridge.license.LicenseServer;
import io.surfworks.filebridge.license.Machine;
import io.surfworks.filebridge.license.MachineFingerprint;
import io.surfworks.filebridge.license.MachineRegistration;
import io.surfworks.filebridge.license.MachineRegistry;
import io.surfworks.filebridge.license.RemoteUnavailableException;
import io.surfworks.filebridge.license.Tier;
import io.surfworks.filebridge.license.UsageTracker;
import io.surfworks.filebridge.license.ValidationCacheEntry;
import io.surfworks.filebridge.license.ValidationRequest;
import io.surfworks.filebridge.license.ValidationResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * The license API answered from billing records.
 *
 * <p>A license is valid while it is ACTIVE, its subscription still grants a tier, and either its
 * paid period has not ended or a grace period is running. Machines are bound here as well, so the
 * cap holds across clients that never talk to each other.
 *
 * <p>With a verdict cache, valid verdicts are kept for a short TTL and served without reading the
 * billing records. The cache must be the one the {@link WebhookReconciler} invalidates, so a
 * committed cancellation or expiry takes effect on the next validation. Machine binding and usage
 * metering run on every call either way.
 */
public class LicenseAuthority implements LicenseServer {

    private static final Logger LOG = Logger.getLogger(LicenseAuthority.class.getName());

    public static final Duration DEFAULT_VERDICT_TTL = Duration.ofMinutes(5);

    private final BillingStore store;
    private final LicenseKeyCodec codec;
    private final FeatureGate gate;
    private final MachineRegistry machines;
    private final UsageTracker usage;
    private final Clock clock;
    private final EntitlementStore verdicts;
    private final Duration verdictTtl;

    /**
     * An authority that reads the billing records on every validation.
     */
    public LicenseAuthority(BillingStore store, LicenseKeyCodec codec, FeatureGate gate,
                            MachineRegistry machines, UsageTracker usage, Clock clock) {
        this(store, codec, gate, machines, usage, clock, null, Duration.ZERO);
    }

    /**
     * An authority that caches valid verdicts in {@code verdicts} for {@code verdictTtl}.
     */
    public LicenseAuthority(BillingStore store, LicenseKeyCodec codec, FeatureGate gate,
                            MachineRegistry machines, UsageTracker usage, Clock clock,
                            EntitlementStore verdicts, Duration verdictTtl) {
        if (verdicts != null && (verdictTtl.isNegative() || verdictTtl.compareTo(ValidationCacheEntry.MAX_TTL) > 0)) {
            throw new IllegalArgumentException("Verdict TTL must be between zero and " + ValidationCacheEntry.MAX_TTL);
        }
        if (!codec.canVerifyChecksum()) {
            throw new IllegalArgumentException("The license authority needs a codec holding the signing secret");
        }
        this.store = store;
        this.codec = codec;
        this.gate = gate;
        this.machines = machines;
        this.usage = usage;
        this.clock = clock;
        this.verdicts = verdicts;
        this.verdictTtl = verdictTtl;
    }

    @Override
    public String getServerName() {
        return "FileBridge billing records";
    }

    @Override
    public ValidationResponse validate(ValidationRequest request) throws RemoteUnavailableException {
        String key;
        try {
            key = codec.validateFormat(request.licenseKey()).key();
        } catch (InvalidLicenseKeyException e) {
            return ValidationResponse.invalid(ValidationResponse.INVALID_FORMAT, e.getMessage());
        }
        String fingerprint = request.machineFingerprint();
        if (fingerprint != null && !MachineFingerprint.isFingerprint(fingerprint)) {
            return ValidationResponse.invalid(ValidationResponse.INVALID_REQUEST,
                "machineFingerprint must be a fingerprint hash");
        }

        Instant now = clock.instant();
        ValidationResponse response;
        int machineLimit;
        Optional<ValidationCacheEntry> cached = cachedVerdict(key, now);
        if (cached.isPresent()) {
            ValidationCacheEntry entry = cached.get();
            response = ValidationResponse.valid(entry.tier(), entry.features(), entry.licenseExpiresAt());
            machineLimit = entry.tier().getMachineLimit();
        } else {
            Verdict verdict = readStore(state -> evaluate(state, key, now));
            response = verdict.response();
            if (!response.valid()) {
                LOG.fine("License " + LicenseKeyCodec.mask(key) + " rejected: " + response.code());
                return response;
            }
            machineLimit = verdict.license().machineLimit();
            cacheVerdict(key, response, now);
        }

        if (fingerprint != null) {
            MachineRegistration registration = machines.registerMachine(key, fingerprint, machineLimit);
            if (!registration.allowed()) {
                return ValidationResponse.invalid(ValidationResponse.MACHINE_LIMIT_EXCEEDED, registration.message());
            }
        }
        if (request.feature() != null && gate.isMetered(request.feature())) {
            usage.recordUsage(key, request.feature());
        }
        return response;
    }

    @Override
    public String generate(String userId, Tier tier, String subscriptionId, Instant expiresAt)
            throws RemoteUnavailableException {
        String key = codec.generate(tier, userId);
        License license = License.issue(key, userId, tier, subscriptionId, clock.instant(), expiresAt);
        try {
            store.transact(state -> {
                state.putLicense(license);
                return null;
            });
        } catch (BillingStoreException e) {
            throw new RemoteUnavailableException("Cannot record the new license", e);
        }
        LOG.info("Generated " + tier + " license " + LicenseKeyCodec.mask(key) + " for user " + userId);
        return key;
    }

    @Override
    public boolean revoke(String licenseKey) throws RemoteUnavailableException {
        Instant now = clock.instant();
        boolean revoked;
        try {
            revoked = store.transact(state -> {
                Optional<License> license = state.license(licenseKey);
                if (license.isEmpty() || license.get().status() == LicenseStatus.REVOKED) {
                    return false;
                }
                state.putLicense(license.get().revokedAt(now));
                return true;
            });
        } catch (BillingStoreException e) {
            throw new RemoteUnavailableException("Cannot revoke license", e);
        }
        if (revoked) {
            if (verdicts != null) {
                verdicts.invalidate(licenseKey);
            }
            LOG.info("Revoked license " + LicenseKeyCodec.mask(licenseKey));
        }
        return revoked;
    }

    /**
     * Usage report for a license.
     *
     * @return empty if no such license exists
     */
    public Optional<LicenseUsage> usage(String licenseKey) throws RemoteUnavailableException {
        Optional<License> license = readStore(state -> state.license(licenseKey));
        if (license.isEmpty()) {
            return Optional.empty();
        }
        License found = license.get();
        List<Machine> bound = machines.listMachines(licenseKey);
        return Optional.of(new LicenseUsage(
            LicenseKeyCodec.mask(licenseKey),
            found.tier(),
            found.status(),
            usage.getDailyUsage(licenseKey, found.tier()),
            (int) bound.stream().filter(Machine::active).count(),
            found.machineLimit(),
            bound
        ));
    }

    private Verdict evaluate(BillingState state, String key, Instant now) {
        Optional<License> found = state.license(key);
        if (found.isEmpty()) {
            return Verdict.rejected(ValidationResponse.LICENSE_NOT_FOUND, "License key not found");
        }
        License license = found.get();
        switch (license.status()) {
            case REVOKED:
                return Verdict.rejected(ValidationResponse.LICENSE_REVOKED, "License has been revoked");
            case SUSPENDED:
                return Verdict.rejected(ValidationResponse.LICENSE_SUSPENDED, "License is suspended");
            case EXPIRED:
                return Verdict.rejected(ValidationResponse.LICENSE_EXPIRED, "License has expired");
            default:
                break;
        }

        Optional<Subscription> subscription = Optional.ofNullable(license.subscriptionId()).flatMap(state::subscription);
        if (subscription.isPresent() && !subscription.get().status().grantsTier()) {
            return Verdict.rejected(ValidationResponse.LICENSE_EXPIRED,
                "Subscription is " + subscription.get().status().name().toLowerCase());
        }

        Instant effectiveExpiry = license.expiresAt();
        if (license.isPastExpiry(now)) {
            Optional<GracePeriod> grace = Optional.ofNullable(license.subscriptionId())
                .flatMap(state::gracePeriod)
                .filter(g -> g.isActive(now));
            if (grace.isEmpty()) {
                return Verdict.rejected(ValidationResponse.LICENSE_EXPIRED,
                    "License expired on " + license.expiresAt());
            }
            effectiveExpiry = grace.get().endsAt();
        }

        return new Verdict(license,
            ValidationResponse.valid(license.tier(), List.copyOf(gate.features(license.tier())), effectiveExpiry));
    }

    private Optional<ValidationCacheEntry> cachedVerdict(String key, Instant now) {
        if (verdicts == null) {
            return Optional.empty();
        }
        return verdicts.load(key).filter(entry -> entry.isWithinTtl(now) && !entry.isLicenseExpired(now));
    }

    private void cacheVerdict(String key, ValidationResponse response, Instant now) {
        if (verdicts == null || verdictTtl.isZero()) {
            return;
        }
        verdicts.save(new ValidationCacheEntry(key, response.tier(), response.features(), now,
            now.plus(verdictTtl), response.expiresAt()));
    }

    private <T> T readStore(Function<BillingState, T> query) throws RemoteUnavailableException {
        try {
            return store.read(query);
        } catch (BillingStoreException e) {
            throw new RemoteUnavailableException("Billing records unavailable", e);
        }
    }

    private record Verdict(License license, ValidationResponse response) {
        static Verdict rejected(String code, String error) {
            return new Verdict(null, ValidationResponse.invalid(code, error));
        }
    }
}
