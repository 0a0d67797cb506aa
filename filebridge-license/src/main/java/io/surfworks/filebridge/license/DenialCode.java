package io.surfworks.filebridge.license;

/**
 * Machine-readable reason a tool call was denied.
 */
public enum DenialCode {
    FEATURE_LOCKED,
    QUOTA_EXCEEDED,
    MACHINE_LIMIT_EXCEEDED,
    LICENSE_EXPIRED,
    INVALID_LICENSE_FORMAT
}
