package io.surfworks.filebridge.license;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entitlement cache stored as one JSON file per license under {@code entitlements/}.
 */
public class FileEntitlementStore implements EntitlementStore {

    private static final Logger LOG = Logger.getLogger(FileEntitlementStore.class.getName());
    private static final String ENTITLEMENTS_DIR = "entitlements";
    private static final Map<Path, Object> LOCKS = new ConcurrentHashMap<>();

    private final Path dir;

    public FileEntitlementStore(Path configDir) {
        this.dir = configDir.resolve(ENTITLEMENTS_DIR);
    }

    @Override
    public Optional<ValidationCacheEntry> load(String licenseKey) {
        Path file = fileFor(licenseKey);
        synchronized (lockFor(file)) {
            ValidationCacheEntry entry = JsonFiles.read(file, ValidationCacheEntry.class);
            if (entry == null || !licenseKey.equals(entry.licenseKey())) {
                return Optional.empty();
            }
            return Optional.of(entry);
        }
    }

    @Override
    public void save(ValidationCacheEntry entry) {
        Path file = fileFor(entry.licenseKey());
        synchronized (lockFor(file)) {
            try {
                JsonFiles.writeAtomically(file, entry);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to persist entitlement cache for "
                    + LicenseKeyCodec.mask(entry.licenseKey()), e);
            }
        }
    }

    @Override
    public void invalidate(String licenseKey) {
        Path file = fileFor(licenseKey);
        synchronized (lockFor(file)) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to invalidate entitlement cache for "
                    + LicenseKeyCodec.mask(licenseKey), e);
            }
        }
    }

    private Path fileFor(String licenseKey) {
        return dir.resolve(JsonFiles.fileNameFor(licenseKey));
    }

    private static Object lockFor(Path file) {
        return LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), p -> new Object());
    }
}
