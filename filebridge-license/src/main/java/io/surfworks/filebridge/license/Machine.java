package io.surfworks.filebridge.license;

import java.time.Instant;

/**
 * A device bound to a license.
 *
 * @param fingerprint one-way hash from {@link MachineFingerprint}
 * @param licenseId owning license key
 * @param firstSeen first successful registration
 * @param lastSeen most recent registration
 * @param active false once deactivated by an explicit action
 */
public record Machine(
    String fingerprint,
    String licenseId,
    Instant firstSeen,
    Instant lastSeen,
    boolean active
) {

    Machine seenAt(Instant now) {
        return new Machine(fingerprint, licenseId, firstSeen, now, active);
    }

    Machine reactivatedAt(Instant now) {
        return new Machine(fingerprint, licenseId, firstSeen, now, true);
    }

    Machine deactivated() {
        return new Machine(fingerprint, licenseId, firstSeen, lastSeen, false);
    }
}
