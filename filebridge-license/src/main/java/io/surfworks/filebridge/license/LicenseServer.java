package io.surfworks.filebridge.license;

import java.time.Instant;

/**
 * The remote license API.
 *
 * <p>{@link HttpLicenseServerClient} talks to it over HTTP; the billing side implements it
 * directly against its records.
 */
public interface LicenseServer {

    /**
     * Check a license key for a machine and feature.
     *
     * @return the verdict; an invalid license is a normal response, not an exception
     * @throws RemoteUnavailableException if no verdict could be obtained
     */
    ValidationResponse validate(ValidationRequest request) throws RemoteUnavailableException;

    /**
     * Issue a new license.
     *
     * @return the generated license key
     */
    String generate(String userId, Tier tier, String subscriptionId, Instant expiresAt)
        throws RemoteUnavailableException;

    /**
     * Revoke a license.
     *
     * @return true if a license was revoked
     */
    boolean revoke(String licenseKey) throws RemoteUnavailableException;

    /**
     * Name for display and logging.
     */
    String getServerName();
}
