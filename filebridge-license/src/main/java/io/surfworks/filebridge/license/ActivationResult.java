package io.surfworks.filebridge.license;

import java.time.Instant;

/**
 * Result of activating a license key on this machine.
 *
 * @param success whether activation succeeded
 * @param tier the activated tier, FREE on failure
 * @param expiresAt end of the paid period, null for perpetual licenses
 * @param error error message if failed
 * @param errorCode machine-readable error code
 */
public record ActivationResult(
    boolean success,
    Tier tier,
    Instant expiresAt,
    String error,
    ErrorCode errorCode
) {

    public enum ErrorCode {
        NONE,
        INVALID_FORMAT,
        INVALID_KEY,
        KEY_EXPIRED,
        MACHINE_LIMIT_REACHED,
        NETWORK_ERROR
    }

    public static ActivationResult success(Tier tier, Instant expiresAt) {
        return new ActivationResult(true, tier, expiresAt, null, ErrorCode.NONE);
    }

    public static ActivationResult failure(String error, ErrorCode code) {
        return new ActivationResult(false, Tier.FREE, null, error, code);
    }
}
