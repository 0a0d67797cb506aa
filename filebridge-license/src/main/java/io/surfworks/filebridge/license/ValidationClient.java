package io.surfworks.filebridge.license;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Decides whether the current caller may run a tool.
 *
 * <p>Resolution order for the caller's tier:
 * <ol>
 *   <li>no license key: FREE</li>
 *   <li>cached validation younger than the revalidation interval: cached tier, no network</li>
 *   <li>remote validation with a bounded timeout; success refreshes the cache</li>
 *   <li>remote unavailable: cached tier while the cache is within its 24h TTL, otherwise FREE</li>
 * </ol>
 * The tier is then checked against the tool's required tier, the FREE daily quota and the
 * machine cap. Infrastructure failures only ever lower the tier; they never grant access.
 *
 * <p>Concurrent checks that need the remote API for the same key share a single call.
 * Callers must invoke {@link #recordUsage(String)} exactly once after an allowed tool finishes.
 */
public class ValidationClient implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ValidationClient.class.getName());

    private final LicenseConfig config;
    private final FeatureGate gate;
    private final EntitlementStore store;
    private final LicenseServer server;
    private final UsageTracker usage;
    private final MachineRegistry machines;
    private final LicenseKeyCodec codec;
    private final Clock clock;
    private final String fingerprint;
    private final ExecutorService remoteExecutor;
    private final Map<String, CompletableFuture<ValidationResponse>> inflight = new ConcurrentHashMap<>();

    private volatile String licenseKey;

    public ValidationClient(LicenseConfig config, FeatureGate gate, EntitlementStore store, LicenseServer server,
                            UsageTracker usage, MachineRegistry machines, Clock clock) {
        this.config = config;
        this.gate = gate;
        this.store = store;
        this.server = server;
        this.usage = usage;
        this.machines = machines;
        this.codec = new LicenseKeyCodec();
        this.clock = clock;
        this.fingerprint = config.machineFingerprint();
        this.remoteExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "filebridge-license-validation");
            thread.setDaemon(true);
            return thread;
        });
        this.licenseKey = normalizeKey(config.licenseKey());

        if (config.bypass()) {
            LOG.warning("[BYPASS] FileBridge license gating is DISABLED. Every tool is unlocked. "
                + "Never run production with this flag.");
        }
    }

    /**
     * Decide whether the caller may run {@code toolName} now.
     *
     * <p>Never throws for licensing reasons; every denial is a value.
     */
    public AccessDecision checkFeatureAccess(String toolName) {
        if (config.bypass()) {
            LOG.warning("[BYPASS] License check skipped for '" + toolName + "'; gating is disabled");
            return AccessDecision.bypassed(toolName);
        }

        Optional<Tier> required = gate.requiredTier(toolName);
        if (required.isEmpty()) {
            return deny(toolName, Tier.FREE, DenialCode.FEATURE_LOCKED,
                "'" + toolName + "' is not a FileBridge feature", null);
        }

        Entitlement entitlement = resolveEntitlement(toolName);
        Tier requiredTier = required.get();

        if (!entitlement.tier().includes(requiredTier)) {
            DenialCode code = entitlement.degradation() != null ? entitlement.degradation() : DenialCode.FEATURE_LOCKED;
            String reason = String.format("'%s' requires %s. Current tier: %s",
                toolName, requiredTier.getDisplayName(), entitlement.tier().getDisplayName());
            if (entitlement.notice() != null) {
                reason = entitlement.notice() + ". " + reason;
            }
            return deny(toolName, entitlement.tier(), code, reason, null);
        }

        if (!gate.isMetered(toolName)) {
            return AccessDecision.allowed(toolName, entitlement.tier(), entitlement.notice(), null);
        }

        DailyUsage today = null;
        if (entitlement.tier() == Tier.FREE) {
            today = usage.getDailyUsage(entitlement.usageSubject(), Tier.FREE);
            if (today.isExceeded()) {
                return deny(toolName, Tier.FREE, DenialCode.QUOTA_EXCEEDED, String.format(
                    "Free tier limit reached (%d calls/day). The quota resets at 00:00 UTC.", today.limit()), today);
            }
        }

        if (entitlement.licensed()) {
            MachineRegistration registration =
                machines.registerMachine(entitlement.licenseKey(), fingerprint, entitlement.tier());
            if (!registration.allowed()) {
                return deny(toolName, entitlement.tier(), DenialCode.MACHINE_LIMIT_EXCEEDED,
                    registration.message(), today);
            }
        }

        String message = today != null ? "Free tier: " + today.describe() : entitlement.notice();
        return AccessDecision.allowed(toolName, entitlement.tier(), message, today);
    }

    /**
     * Count one completed call of an allowed tool against today's usage.
     */
    public void recordUsage(String toolName) {
        if (config.bypass() || !gate.isMetered(toolName)) {
            return;
        }
        usage.recordUsage(currentUsageSubject(), toolName);
    }

    /**
     * Validate a key remotely, bind this machine and make it the active key.
     */
    public ActivationResult activate(String key) {
        ParsedLicenseKey parsed;
        try {
            parsed = codec.validateFormat(key);
        } catch (InvalidLicenseKeyException e) {
            return ActivationResult.failure(e.getMessage(), ActivationResult.ErrorCode.INVALID_FORMAT);
        }
        String normalized = parsed.key();

        ValidationResponse response;
        try {
            response = validateRemotely(new ValidationRequest(normalized, fingerprint, null));
        } catch (RemoteUnavailableException e) {
            return ActivationResult.failure("Cannot reach the license server: " + e.getMessage(),
                ActivationResult.ErrorCode.NETWORK_ERROR);
        }

        if (!response.valid()) {
            store.invalidate(normalized);
            String error = response.error() != null ? response.error() : "License key is not valid";
            ActivationResult.ErrorCode code = response.isExpired()
                ? ActivationResult.ErrorCode.KEY_EXPIRED
                : response.isMachineLimitExceeded()
                    ? ActivationResult.ErrorCode.MACHINE_LIMIT_REACHED
                    : ActivationResult.ErrorCode.INVALID_KEY;
            return ActivationResult.failure(error, code);
        }

        MachineRegistration registration = machines.registerMachine(normalized, fingerprint, response.tier());
        if (!registration.allowed()) {
            return ActivationResult.failure(registration.message(), ActivationResult.ErrorCode.MACHINE_LIMIT_REACHED);
        }

        store.save(ValidationCacheEntry.of(normalized, response.tier(), response.features(),
            clock.instant(), response.expiresAt()));
        licenseKey = normalized;
        LOG.info("License " + LicenseKeyCodec.mask(normalized) + " activated: " + response.tier().getDisplayName());
        return ActivationResult.success(response.tier(), response.expiresAt());
    }

    /**
     * Release this machine's seat and forget the active key.
     */
    public void deactivate() {
        String key = licenseKey;
        if (key == null) {
            return;
        }
        machines.deactivateMachine(key, fingerprint);
        store.invalidate(key);
        licenseKey = null;
        LOG.info("License " + LicenseKeyCodec.mask(key) + " deactivated on this machine");
    }

    /**
     * Current entitlement for display. May trigger a remote validation.
     */
    public EntitlementSnapshot snapshot() {
        if (config.bypass()) {
            return new EntitlementSnapshot(Tier.ENTERPRISE, maskedKey(), null, null, null, null, 0,
                Tier.ENTERPRISE.getMachineLimit(), true, "License checks bypassed (development mode)");
        }

        Entitlement entitlement = resolveEntitlement(null);
        String key = licenseKey;
        Optional<ValidationCacheEntry> cached = key != null ? store.load(key) : Optional.empty();

        return new EntitlementSnapshot(
            entitlement.tier(),
            maskedKey(),
            cached.map(ValidationCacheEntry::validatedAt).orElse(null),
            cached.map(ValidationCacheEntry::ttlExpiresAt).orElse(null),
            cached.map(ValidationCacheEntry::licenseExpiresAt).orElse(null),
            usage.getDailyUsage(entitlement.usageSubject(), entitlement.tier()),
            key != null ? machines.activeCount(key) : 0,
            entitlement.tier().getMachineLimit(),
            false,
            entitlement.notice()
        );
    }

    public String currentLicenseKey() {
        return licenseKey;
    }

    public String machineFingerprint() {
        return fingerprint;
    }

    public String upgradeUrl() {
        return config.upgradeUrl();
    }

    @Override
    public void close() {
        remoteExecutor.shutdownNow();
    }

    // ========== Resolution ==========

    private Entitlement resolveEntitlement(String feature) {
        String key = licenseKey;
        if (key == null) {
            return Entitlement.anonymous();
        }
        if (!codec.isWellFormed(key)) {
            return Entitlement.degraded(key, DenialCode.INVALID_LICENSE_FORMAT, "The configured license key is malformed");
        }

        Instant now = clock.instant();
        Optional<ValidationCacheEntry> cached = store.load(key);
        if (cached.isPresent()) {
            ValidationCacheEntry entry = cached.get();
            if (entry.isWithinTtl(now)
                    && !entry.isLicenseExpired(now)
                    && !entry.needsRevalidation(now, config.revalidationInterval())) {
                return fromCache(entry, now);
            }
        }

        try {
            ValidationResponse response = validateRemotely(new ValidationRequest(key, fingerprint, feature));
            return applyRemote(key, response);
        } catch (RemoteUnavailableException e) {
            if (cached.isPresent() && cached.get().isWithinTtl(now)) {
                ValidationCacheEntry entry = cached.get();
                LOG.warning("License API unavailable (" + e.getMessage() + "); using cached "
                    + entry.tier() + " entitlement until " + entry.ttlExpiresAt());
                return fromCache(entry, now);
            }
            LOG.warning("License API unavailable (" + e.getMessage() + ") and no usable cached validation; "
                + "falling back to FREE");
            if (cached.isPresent() && cached.get().isLicenseExpired(now)) {
                return Entitlement.degraded(key, DenialCode.LICENSE_EXPIRED,
                    "License expired on " + cached.get().licenseExpiresAt());
            }
            return Entitlement.degraded(key, null,
                "License could not be validated for over 24 hours; paid features resume after the next successful check");
        }
    }

    private Entitlement applyRemote(String key, ValidationResponse response) {
        Instant validatedAt = clock.instant();
        if (response.valid()) {
            ValidationCacheEntry entry = ValidationCacheEntry.of(
                key, response.tier(), response.features(), validatedAt, response.expiresAt());
            store.save(entry);
            return fromCache(entry, validatedAt);
        }

        store.invalidate(key);
        if (response.isExpired()) {
            return Entitlement.degraded(key, DenialCode.LICENSE_EXPIRED,
                response.error() != null ? response.error() : "License expired");
        }
        if (response.isMachineLimitExceeded()) {
            return Entitlement.degraded(key, DenialCode.MACHINE_LIMIT_EXCEEDED, response.error());
        }
        return Entitlement.degraded(key, null, "License is not valid ("
            + (response.error() != null ? response.error() : response.code()) + ")");
    }

    private static Entitlement fromCache(ValidationCacheEntry entry, Instant now) {
        if (entry.isLicenseExpired(now)) {
            return Entitlement.degraded(entry.licenseKey(), DenialCode.LICENSE_EXPIRED,
                "License expired on " + entry.licenseExpiresAt());
        }
        return new Entitlement(entry.licenseKey(), entry.tier(), true, null, null);
    }

    private ValidationResponse validateRemotely(ValidationRequest request) throws RemoteUnavailableException {
        String key = request.licenseKey();
        CompletableFuture<ValidationResponse> created = new CompletableFuture<>();
        CompletableFuture<ValidationResponse> existing = inflight.putIfAbsent(key, created);
        CompletableFuture<ValidationResponse> future = existing != null ? existing : created;

        if (existing == null) {
            try {
                // Leave the map before completing so a later caller starts a fresh call.
                remoteExecutor.execute(() -> {
                    ValidationResponse response;
                    try {
                        response = server.validate(request);
                    } catch (RemoteUnavailableException | RuntimeException e) {
                        inflight.remove(key, created);
                        created.completeExceptionally(e);
                        return;
                    }
                    inflight.remove(key, created);
                    created.complete(response);
                });
            } catch (RejectedExecutionException e) {
                inflight.remove(key, created);
                throw new RemoteUnavailableException("Validation client is closed", e);
            }
        }

        try {
            return future.get(config.remoteTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RemoteUnavailableException("timed out after " + config.remoteTimeout().toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RemoteUnavailableException) {
                throw (RemoteUnavailableException) cause;
            }
            throw new RemoteUnavailableException("validation call failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteUnavailableException("interrupted", e);
        }
    }

    private String currentUsageSubject() {
        String key = licenseKey;
        if (key == null) {
            return UsageTracker.ANONYMOUS;
        }
        Instant now = clock.instant();
        boolean licensed = store.load(key)
            .map(entry -> entry.isWithinTtl(now) && !entry.isLicenseExpired(now))
            .orElse(false);
        return licensed ? key : UsageTracker.ANONYMOUS;
    }

    private AccessDecision deny(String toolName, Tier tier, DenialCode code, String reason, DailyUsage today) {
        LOG.fine("Denied '" + toolName + "': " + code);
        return AccessDecision.denied(toolName, tier, code, reason, config.upgradeUrl(), gate.preview(toolName), today);
    }

    private String maskedKey() {
        String key = licenseKey;
        return key != null ? LicenseKeyCodec.mask(key) : null;
    }

    private static String normalizeKey(String key) {
        return key == null ? null : key.trim().toUpperCase(java.util.Locale.ROOT);
    }

    /**
     * Tier resolved for one check.
     *
     * @param licenseKey configured key, null when anonymous
     * @param tier effective tier
     * @param licensed true only when the tier comes from a currently valid license
     * @param degradation code to report when the tier was lowered for a license reason
     * @param notice explanation of the degradation
     */
    private record Entitlement(String licenseKey, Tier tier, boolean licensed, DenialCode degradation, String notice) {

        static Entitlement anonymous() {
            return new Entitlement(null, Tier.FREE, false, null, null);
        }

        static Entitlement degraded(String licenseKey, DenialCode code, String notice) {
            return new Entitlement(licenseKey, Tier.FREE, false, code, notice);
        }

        String usageSubject() {
            return licensed ? licenseKey : UsageTracker.ANONYMOUS;
        }
    }
}
