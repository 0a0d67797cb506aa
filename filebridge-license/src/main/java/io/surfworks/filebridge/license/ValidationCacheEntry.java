package io.surfworks.filebridge.license;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Locally persisted result of the last successful remote validation.
 *
 * <p>{@code ttlExpiresAt} is never more than {@link #MAX_TTL} after {@code validatedAt};
 * past it the entry cannot grant anything beyond FREE.
 *
 * @param licenseKey the validated key
 * @param tier tier granted by the remote check
 * @param features features granted by the remote check
 * @param validatedAt when the remote check succeeded
 * @param ttlExpiresAt hard offline cutoff
 * @param licenseExpiresAt end of the paid period, null for perpetual licenses
 */
public record ValidationCacheEntry(
    String licenseKey,
    Tier tier,
    List<String> features,
    Instant validatedAt,
    Instant ttlExpiresAt,
    Instant licenseExpiresAt
) {

    public static final Duration MAX_TTL = Duration.ofHours(24);

    public ValidationCacheEntry {
        features = features == null ? List.of() : List.copyOf(features);
        tier = tier == null ? Tier.FREE : tier;
        Instant cap = validatedAt.plus(MAX_TTL);
        if (ttlExpiresAt == null || ttlExpiresAt.isAfter(cap)) {
            ttlExpiresAt = cap;
        }
    }

    public static ValidationCacheEntry of(String licenseKey, Tier tier, List<String> features,
                                          Instant validatedAt, Instant licenseExpiresAt) {
        return new ValidationCacheEntry(licenseKey, tier, features, validatedAt,
            validatedAt.plus(MAX_TTL), licenseExpiresAt);
    }

    /**
     * Whether the entry may still be trusted offline.
     */
    public boolean isWithinTtl(Instant now) {
        return now.isBefore(ttlExpiresAt);
    }

    /**
     * Whether a fresh remote check is due.
     */
    public boolean needsRevalidation(Instant now, Duration interval) {
        return !now.isBefore(validatedAt.plus(interval));
    }

    public boolean isLicenseExpired(Instant now) {
        return licenseExpiresAt != null && !now.isBefore(licenseExpiresAt);
    }
}
