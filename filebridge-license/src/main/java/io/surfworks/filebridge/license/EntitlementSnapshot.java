package io.surfworks.filebridge.license;

import java.time.Instant;

/**
 * Point-in-time view of this machine's entitlement, for status displays.
 *
 * @param tier resolved tier
 * @param maskedKey masked license key, null when none is configured
 * @param validatedAt last successful remote validation, null if never
 * @param offlineUntil when the cached validation stops granting paid features
 * @param licenseExpiresAt end of the paid period
 * @param usage today's usage against the tier's quota
 * @param activeMachines machines bound to the license
 * @param machineLimit the tier's machine cap
 * @param bypassed whether the development bypass is active
 * @param notice explanation when the tier was degraded
 */
public record EntitlementSnapshot(
    Tier tier,
    String maskedKey,
    Instant validatedAt,
    Instant offlineUntil,
    Instant licenseExpiresAt,
    DailyUsage usage,
    int activeMachines,
    int machineLimit,
    boolean bypassed,
    String notice
) {
}
