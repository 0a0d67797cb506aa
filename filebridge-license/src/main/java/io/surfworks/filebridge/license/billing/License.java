package io.surfworks.filebridge.license.billing;

import io.surfworks.filebridge.license.Tier;

import java.time.Instant;

/**
 * An issued license.
 *
 * @param licenseKey the key handed to the customer
 * @param userId owner
 * @param tier granted tier
 * @param status lifecycle status
 * @param subscriptionId subscription that pays for it, null for manually issued licenses
 * @param issuedAt when the key was generated
 * @param expiresAt end of the paid period, null for perpetual licenses
 * @param revokedAt when it was revoked, null otherwise
 * @param machineLimit maximum active machines
 * @param dailyCallLimit calls per UTC day, or {@link Tier#UNLIMITED}
 */
public record License(
    String licenseKey,
    String userId,
    Tier tier,
    LicenseStatus status,
    String subscriptionId,
    Instant issuedAt,
    Instant expiresAt,
    Instant revokedAt,
    int machineLimit,
    int dailyCallLimit
) {

    public static License issue(String licenseKey, String userId, Tier tier, String subscriptionId,
                                Instant issuedAt, Instant expiresAt) {
        return new License(licenseKey, userId, tier, LicenseStatus.ACTIVE, subscriptionId, issuedAt, expiresAt,
            null, tier.getMachineLimit(), tier.getDailyCallLimit());
    }

    public boolean isPastExpiry(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    License withTier(Tier newTier) {
        return new License(licenseKey, userId, newTier, status, subscriptionId, issuedAt, expiresAt, revokedAt,
            newTier.getMachineLimit(), newTier.getDailyCallLimit());
    }

    License withStatus(LicenseStatus newStatus) {
        return new License(licenseKey, userId, tier, newStatus, subscriptionId, issuedAt, expiresAt, revokedAt,
            machineLimit, dailyCallLimit);
    }

    License withExpiresAt(Instant newExpiresAt) {
        return new License(licenseKey, userId, tier, status, subscriptionId, issuedAt, newExpiresAt, revokedAt,
            machineLimit, dailyCallLimit);
    }

    License revokedAt(Instant when) {
        return new License(licenseKey, userId, tier, LicenseStatus.REVOKED, subscriptionId, issuedAt, expiresAt,
            when, machineLimit, dailyCallLimit);
    }
}
