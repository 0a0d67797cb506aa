package io.surfworks.filebridge.license.billing;

/**
 * Lifecycle status of an issued license. Licenses are never deleted, only moved between statuses.
 */
public enum LicenseStatus {
    ACTIVE,
    EXPIRED,
    REVOKED,
    SUSPENDED
}
