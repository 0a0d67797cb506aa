package io.surfworks.filebridge.license;

/**
 * The remote license API could not be reached or answered with a server error.
 *
 * <p>Always recovered internally through the entitlement cache or a FREE fallback.
 */
public class RemoteUnavailableException extends Exception {

    public RemoteUnavailableException(String message) {
        super(message);
    }

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
