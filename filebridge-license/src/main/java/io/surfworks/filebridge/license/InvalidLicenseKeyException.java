package io.surfworks.filebridge.license;

/**
 * Thrown when a license key string does not have the expected shape or checksum.
 */
public class InvalidLicenseKeyException extends Exception {

    public InvalidLicenseKeyException(String message) {
        super(message);
    }
}
