package io.surfworks.filebridge.license;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent entitlement cache for tests and embedded use.
 */
public class InMemoryEntitlementStore implements EntitlementStore {

    private final Map<String, ValidationCacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ValidationCacheEntry> load(String licenseKey) {
        return Optional.ofNullable(entries.get(licenseKey));
    }

    @Override
    public void save(ValidationCacheEntry entry) {
        entries.put(entry.licenseKey(), entry);
    }

    @Override
    public void invalidate(String licenseKey) {
        entries.remove(licenseKey);
    }

    public int size() {
        return entries.size();
    }
}
