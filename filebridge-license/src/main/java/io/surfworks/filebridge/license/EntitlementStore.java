package io.surfworks.filebridge.license;

import java.util.Optional;

/**
 * Durable cache of the last known entitlement per license key.
 *
 * <p>The cache is derived state: it can always be invalidated and recomputed from a remote
 * validation. Implementations must make {@link #save} atomic.
 */
public interface EntitlementStore {

    Optional<ValidationCacheEntry> load(String licenseKey);

    void save(ValidationCacheEntry entry);

    void invalidate(String licenseKey);
}
