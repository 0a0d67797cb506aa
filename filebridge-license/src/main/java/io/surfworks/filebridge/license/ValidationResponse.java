package io.surfworks.filebridge.license;

import java.time.Instant;
import java.util.List;

/**
 * Result of a {@code validate-license} call.
 *
 * @param valid whether the license currently grants its tier
 * @param tier granted tier (FREE when invalid)
 * @param features features granted
 * @param expiresAt end of the paid period, null for perpetual licenses
 * @param code machine-readable reason when invalid
 * @param error human-readable reason when invalid
 */
public record ValidationResponse(
    boolean valid,
    Tier tier,
    List<String> features,
    Instant expiresAt,
    String code,
    String error
) {

    public static final String LICENSE_NOT_FOUND = "LICENSE_NOT_FOUND";
    public static final String LICENSE_EXPIRED = "LICENSE_EXPIRED";
    public static final String LICENSE_REVOKED = "LICENSE_REVOKED";
    public static final String LICENSE_SUSPENDED = "LICENSE_SUSPENDED";
    public static final String INVALID_FORMAT = "INVALID_FORMAT";
    public static final String MACHINE_LIMIT_EXCEEDED = "MACHINE_LIMIT_EXCEEDED";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    public ValidationResponse {
        tier = tier == null ? Tier.FREE : tier;
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static ValidationResponse valid(Tier tier, List<String> features, Instant expiresAt) {
        return new ValidationResponse(true, tier, features, expiresAt, null, null);
    }

    public static ValidationResponse invalid(String code, String error) {
        return new ValidationResponse(false, Tier.FREE, List.of(), null, code, error);
    }

    public boolean isExpired() {
        return LICENSE_EXPIRED.equals(code);
    }

    public boolean isMachineLimitExceeded() {
        return MACHINE_LIMIT_EXCEEDED.equals(code);
    }
}
