package io.surfworks.filebridge.license;

import java.time.Instant;

/**
 * The segments of a well-formed license key.
 *
 * @param key the normalized key string
 * @param tier tier encoded in the key prefix
 * @param issuedAt issue time encoded in the timestamp segment
 * @param userHash first 8 hex chars of the owner's hashed id
 * @param random the random segment
 * @param checksum the checksum segment
 * @param checksumVerified true only when the checksum was recomputed with the server secret
 */
public record ParsedLicenseKey(
    String key,
    Tier tier,
    Instant issuedAt,
    String userHash,
    String random,
    String checksum,
    boolean checksumVerified
) {
}
