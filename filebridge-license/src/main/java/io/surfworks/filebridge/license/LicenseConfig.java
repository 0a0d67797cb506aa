package io.surfworks.filebridge.license;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration for FileBridge licensing.
 *
 * <p>Built once at startup from CLI switches, then environment variables, then defaults,
 * and passed to {@link EntitlementContext}. Instances are immutable.
 */
public final class LicenseConfig {

    /**
     * Environment variable for the license key.
     */
    public static final String ENV_LICENSE_KEY = "FILEBRIDGE_LICENSE";

    /**
     * Environment variable that bypasses all gating for local development.
     */
    public static final String ENV_BYPASS = "FILEBRIDGE_LICENSE_BYPASS";

    /**
     * Legacy spelling of {@link #ENV_BYPASS}.
     */
    public static final String ENV_DISABLE_LICENSE = "DISABLE_LICENSE";

    /**
     * Environment variable for debug mode, which implies bypass.
     */
    public static final String ENV_DEBUG_MODE = "FILEBRIDGE_DEBUG_MODE";

    /**
     * Environment variable for the remote license API base URL.
     */
    public static final String ENV_VALIDATION_URL = "FILEBRIDGE_VALIDATION_URL";

    /**
     * Environment variable overriding the state directory.
     */
    public static final String ENV_CONFIG_DIR = "FILEBRIDGE_CONFIG_DIR";

    /**
     * Environment variable overriding the upgrade link shown on denial.
     */
    public static final String ENV_UPGRADE_URL = "FILEBRIDGE_UPGRADE_URL";

    public static final String ARG_ACTIVATE = "--activate";
    public static final String ARG_SETUP = "--setup";
    public static final String ARG_DEBUG_MODE = "--debug-mode";

    public static final String DEFAULT_VALIDATION_URL = "http://localhost:3001";
    public static final String DEFAULT_UPGRADE_URL = "https://filebridge.dev/pricing";
    public static final Duration DEFAULT_REMOTE_TIMEOUT = Duration.ofSeconds(5);

    private final String licenseKey;
    private final boolean bypass;
    private final boolean interactiveSetup;
    private final Path configDir;
    private final String validationUrl;
    private final String upgradeUrl;
    private final Duration remoteTimeout;
    private final Duration revalidationInterval;
    private final String machineFingerprint;

    private LicenseConfig(Builder builder) {
        this.licenseKey = blankToNull(builder.licenseKey);
        this.bypass = builder.bypass;
        this.interactiveSetup = builder.interactiveSetup;
        this.configDir = builder.configDir;
        this.validationUrl = builder.validationUrl;
        this.upgradeUrl = builder.upgradeUrl;
        this.remoteTimeout = builder.remoteTimeout;
        this.revalidationInterval = builder.revalidationInterval.compareTo(ValidationCacheEntry.MAX_TTL) > 0
            ? ValidationCacheEntry.MAX_TTL
            : builder.revalidationInterval;
        this.machineFingerprint = builder.machineFingerprint;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration from the process environment and command line.
     */
    public static LicenseConfig load(String[] args) {
        return fromSources(args, System.getenv(), System.getProperty("user.home"));
    }

    /**
     * Configuration from explicit sources. CLI switches win over the environment.
     *
     * @param args command-line arguments; unknown ones are ignored
     * @param env environment variables
     * @param userHome home directory used for the default state directory
     */
    public static LicenseConfig fromSources(String[] args, Map<String, String> env, String userHome) {
        Builder builder = builder()
            .licenseKey(env.get(ENV_LICENSE_KEY))
            .bypass(isTrue(env.get(ENV_BYPASS)) || isTrue(env.get(ENV_DISABLE_LICENSE)) || isTrue(env.get(ENV_DEBUG_MODE)))
            .configDir(resolveConfigDir(env, userHome));

        String validationUrl = env.get(ENV_VALIDATION_URL);
        if (validationUrl != null && !validationUrl.isBlank()) {
            builder.validationUrl(validationUrl.trim());
        }
        String upgradeUrl = env.get(ENV_UPGRADE_URL);
        if (upgradeUrl != null && !upgradeUrl.isBlank()) {
            builder.upgradeUrl(upgradeUrl.trim());
        }

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals(ARG_ACTIVATE) && i + 1 < args.length) {
                builder.licenseKey(args[++i]);
            } else if (arg.startsWith(ARG_ACTIVATE + "=")) {
                builder.licenseKey(arg.substring(ARG_ACTIVATE.length() + 1));
            } else if (arg.equals(ARG_SETUP)) {
                builder.interactiveSetup(true);
            } else if (arg.equals(ARG_DEBUG_MODE)) {
                builder.bypass(true);
            }
        }

        return builder.build();
    }

    /**
     * License key from {@code --activate} or the environment, null if none.
     */
    public String licenseKey() {
        return licenseKey;
    }

    /**
     * Whether all gating is bypassed. Off unless explicitly requested.
     */
    public boolean bypass() {
        return bypass;
    }

    public boolean interactiveSetup() {
        return interactiveSetup;
    }

    public Path configDir() {
        return configDir;
    }

    public String validationUrl() {
        return validationUrl;
    }

    public String upgradeUrl() {
        return upgradeUrl;
    }

    public Duration remoteTimeout() {
        return remoteTimeout;
    }

    /**
     * How long a cached validation is used before a remote check is attempted.
     * Never longer than {@link ValidationCacheEntry#MAX_TTL}.
     */
    public Duration revalidationInterval() {
        return revalidationInterval;
    }

    /**
     * Fingerprint of this machine, computed on first use unless set explicitly.
     */
    public String machineFingerprint() {
        return machineFingerprint != null ? machineFingerprint : MachineFingerprint.generate();
    }

    public Builder toBuilder() {
        return builder()
            .licenseKey(licenseKey)
            .bypass(bypass)
            .interactiveSetup(interactiveSetup)
            .configDir(configDir)
            .validationUrl(validationUrl)
            .upgradeUrl(upgradeUrl)
            .remoteTimeout(remoteTimeout)
            .revalidationInterval(revalidationInterval)
            .machineFingerprint(machineFingerprint);
    }

    private static Path resolveConfigDir(Map<String, String> env, String userHome) {
        String explicit = env.get(ENV_CONFIG_DIR);
        if (explicit != null && !explicit.isBlank()) {
            return Path.of(explicit);
        }
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null && !configHome.isBlank()) {
            return Path.of(configHome, "filebridge");
        }
        return Path.of(userHome, ".config", "filebridge");
    }

    private static boolean isTrue(String value) {
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static final class Builder {
        private String licenseKey;
        private boolean bypass;
        private boolean interactiveSetup;
        private Path configDir = Path.of(System.getProperty("user.home"), ".config", "filebridge");
        private String validationUrl = DEFAULT_VALIDATION_URL;
        private String upgradeUrl = DEFAULT_UPGRADE_URL;
        private Duration remoteTimeout = DEFAULT_REMOTE_TIMEOUT;
        private Duration revalidationInterval = ValidationCacheEntry.MAX_TTL;
        private String machineFingerprint;

        private Builder() {}

        public Builder licenseKey(String licenseKey) {
            this.licenseKey = licenseKey;
            return this;
        }

        public Builder bypass(boolean bypass) {
            this.bypass = bypass;
            return this;
        }

        public Builder interactiveSetup(boolean interactiveSetup) {
            this.interactiveSetup = interactiveSetup;
            return this;
        }

        public Builder configDir(Path configDir) {
            this.configDir = configDir;
            return this;
        }

        public Builder validationUrl(String validationUrl) {
            this.validationUrl = validationUrl;
            return this;
        }

        public Builder upgradeUrl(String upgradeUrl) {
            this.upgradeUrl = upgradeUrl;
            return this;
        }

        public Builder remoteTimeout(Duration remoteTimeout) {
            this.remoteTimeout = remoteTimeout;
            return this;
        }

        public Builder revalidationInterval(Duration revalidationInterval) {
            this.revalidationInterval = revalidationInterval;
            return this;
        }

        public Builder machineFingerprint(String machineFingerprint) {
            this.machineFingerprint = machineFingerprint;
            return this;
        }

        public LicenseConfig build() {
            return new LicenseConfig(this);
        }
    }
}
