package io.surfworks.filebridge.license;

/**
 * Body of a {@code validate-license} call.
 *
 * @param licenseKey the key to validate
 * @param machineFingerprint fingerprint hash of the calling machine
 * @param feature tool the caller is about to run, may be null for activation
 */
public record ValidationRequest(String licenseKey, String machineFingerprint, String feature) {
}
