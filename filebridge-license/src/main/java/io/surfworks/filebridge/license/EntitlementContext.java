package io.surfworks.filebridge.license;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point for FileBridge licensing.
 *
 * <p>One context is built at startup and handed to whatever dispatches tools. Storage and the
 * remote license API are plain constructor inputs, so tests and alternative deployments swap
 * them through {@link #builder(LicenseConfig)}.
 *
 * <p>Usage:
 * <pre>{@code
 * EntitlementContext license = EntitlementContext.create(LicenseConfig.load(args));
 *
 * AccessDecision decision = license.checkFeatureAccess("batch_operations");
 * if (!decision.allowed()) {
 *     return decision.toResponse();
 * }
 * Object result = runTool();
 * license.recordUsage("batch_operations");
 * }</pre>
 */
public final class EntitlementContext implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(EntitlementContext.class.getName());

    static final String ACTIVATED_LICENSE_FILE = "license.json";

    private final LicenseConfig config;
    private final FeatureGate gate;
    private final EntitlementStore entitlements;
    private final UsageTracker usage;
    private final MachineRegistry machines;
    private final ValidationClient client;
    private final Path activatedLicenseFile;

    private EntitlementContext(Builder builder) {
        LicenseConfig base = builder.config;
        this.activatedLicenseFile = base.configDir().resolve(ACTIVATED_LICENSE_FILE);
        if (base.licenseKey() == null) {
            String remembered = readActivatedKey(activatedLicenseFile);
            if (remembered != null) {
                base = base.toBuilder().licenseKey(remembered).build();
            }
        }
        this.config = base;

        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.gate = builder.gate != null ? builder.gate : FeatureGate.STANDARD;
        this.entitlements = builder.entitlements != null
            ? builder.entitlements
            : new FileEntitlementStore(config.configDir());
        this.usage = builder.usage != null ? builder.usage : new UsageTracker(config.configDir(), clock);
        this.machines = builder.machines != null ? builder.machines : new MachineRegistry(config.configDir(), clock);
        LicenseServer server = builder.server != null
            ? builder.server
            : new HttpLicenseServerClient(config.validationUrl(), config.remoteTimeout());

        this.client = new ValidationClient(config, gate, entitlements, server, usage, machines, clock);
        LOG.fine("License context ready (server=" + server.getServerName() + ", state=" + config.configDir() + ")");
    }

    /**
     * Context backed by files under the configured directory and the HTTP license API.
     */
    public static EntitlementContext create(LicenseConfig config) {
        return builder(config).build();
    }

    public static Builder builder(LicenseConfig config) {
        return new Builder(config);
    }

    public AccessDecision checkFeatureAccess(String toolName) {
        return client.checkFeatureAccess(toolName);
    }

    public void recordUsage(String toolName) {
        client.recordUsage(toolName);
    }

    /**
     * Activate a license key on this machine and remember it for later runs.
     */
    public ActivationResult activate(String licenseKey) {
        ActivationResult result = client.activate(licenseKey);
        if (result.success()) {
            rememberKey(client.currentLicenseKey());
        }
        return result;
    }

    /**
     * Deactivate the current license.
     *
     * <p>This frees up the machine slot for use on another machine.
     */
    public void deactivate() {
        client.deactivate();
        try {
            Files.deleteIfExists(activatedLicenseFile);
        } catch (IOException e) {
            LOG.warning("Failed to remove " + activatedLicenseFile + ": " + e.getMessage());
        }
    }

    public EntitlementSnapshot status() {
        return client.snapshot();
    }

    /**
     * Machines bound to the current license; empty when no license is configured.
     */
    public List<Machine> listMachines() {
        String key = client.currentLicenseKey();
        return key == null ? List.of() : machines.listMachines(key);
    }

    /**
     * Free the slot held by another machine of the current license.
     *
     * @return true if an active machine was released
     */
    public boolean deactivateMachine(String fingerprint) {
        String key = client.currentLicenseKey();
        if (key == null) {
            return false;
        }
        return machines.deactivateMachine(key, fingerprint);
    }

    public LicenseConfig config() {
        return config;
    }

    public FeatureGate featureGate() {
        return gate;
    }

    public UsageTracker usageTracker() {
        return usage;
    }

    public MachineRegistry machineRegistry() {
        return machines;
    }

    public EntitlementStore entitlementStore() {
        return entitlements;
    }

    public String machineFingerprint() {
        return client.machineFingerprint();
    }

    public String machineName() {
        return MachineFingerprint.getMachineName();
    }

    @Override
    public void close() {
        client.close();
    }

    // ========== Private Methods ==========

    private void rememberKey(String licenseKey) {
        try {
            JsonFiles.writeAtomically(activatedLicenseFile, new ActivatedLicense(licenseKey, Instant.now()));
        } catch (IOException e) {
            LOG.warning("License activated but could not be saved to " + activatedLicenseFile + ": " + e.getMessage());
        }
    }

    private static String readActivatedKey(Path file) {
        ActivatedLicense stored = JsonFiles.read(file, ActivatedLicense.class);
        return stored != null ? stored.licenseKey() : null;
    }

    private record ActivatedLicense(String licenseKey, Instant activatedAt) {
    }

    public static final class Builder {
        private final LicenseConfig config;
        private FeatureGate gate;
        private EntitlementStore entitlements;
        private UsageTracker usage;
        private MachineRegistry machines;
        private LicenseServer server;
        private Clock clock;

        private Builder(LicenseConfig config) {
            this.config = config;
        }

        public Builder featureGate(FeatureGate gate) {
            this.gate = gate;
            return this;
        }

        public Builder entitlementStore(EntitlementStore entitlements) {
            this.entitlements = entitlements;
            return this;
        }

        public Builder usageTracker(UsageTracker usage) {
            this.usage = usage;
            return this;
        }

        public Builder machineRegistry(MachineRegistry machines) {
            this.machines = machines;
            return this;
        }

        public Builder licenseServer(LicenseServer server) {
            this.server = server;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public EntitlementContext build() {
            return new EntitlementContext(this);
        }
    }
}
